package dev.contentscanner.service;

import dev.contentscanner.ai.SummaryClient;
import dev.contentscanner.config.AnalysisConfig;
import dev.contentscanner.metrics.AnalysisMetrics;
import dev.contentscanner.model.AggregateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Off the critical path: a failing or slow summary provider yields an empty summary, never an error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SummaryService {

    private final SummaryClient summaryClient;
    private final AnalysisConfig analysisConfig;
    private final AnalysisMetrics metrics;

    public Mono<Optional<String>> summarize(AggregateResult result) {
        if (!analysisConfig.isSummaryEnabled() || !summaryClient.isEnabled()) {
            log.debug("Summaries disabled - skipping");
            return Mono.just(Optional.empty());
        }
        if (result == null || !result.hasUsableScores()) {
            log.debug("No usable scores - skipping summary");
            return Mono.just(Optional.empty());
        }

        return summaryClient.summarize(result)
                .timeout(analysisConfig.getSummaryTimeout())
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .onErrorResume(e -> {
                    log.warn("Summary generation failed, leaving summary empty: {}", e.getMessage());
                    metrics.recordSummaryFailure();
                    return Mono.just(Optional.empty());
                });
    }
}
