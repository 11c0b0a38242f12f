package dev.contentscanner.ai;

import dev.contentscanner.model.AggregateResult;
import dev.contentscanner.model.SafetyStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Local summary built from the aggregate without calling an AI provider.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.summary.provider", havingValue = "template", matchIfMissing = true)
public class TemplateSummaryClient implements SummaryClient {

    public TemplateSummaryClient() {
        log.info("AI summary disabled - using template summaries");
    }

    @Override
    public Mono<String> summarize(AggregateResult result) {
        return Mono.fromSupplier(() -> render(result));
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    String render(AggregateResult result) {
        StringBuilder text = new StringBuilder();
        text.append(String.format("Analyzed %d media item(s): %d scored, %d pre-cleared, %d failed. ",
                result.total(), result.analyzed(), result.skipped(), result.errored()));

        List<String> flagged = SummaryPrompts.flaggedCategories(result);
        if (flagged.isEmpty()) {
            text.append("No risky categories detected. ");
        } else {
            text.append("Categories needing attention: ");
            text.append(String.join(", ", flagged.stream()
                    .map(category -> category + " (" + result.categoryStatuses().get(category) + ")")
                    .toList()));
            text.append(". ");
        }
        result.explanations().forEach((category, explanation) -> {
            if (result.categoryStatuses().containsKey(category)) {
                text.append(explanation).append(' ');
            }
        });

        text.append(recommendation(result));
        return text.toString().trim();
    }

    private String recommendation(AggregateResult result) {
        if (result.status() == SafetyStatus.REJECTED) {
            return "Content is not suitable for campaign use without changes.";
        }
        if (result.status() == SafetyStatus.WARNING || result.errored() > 0) {
            return "Manual review is recommended before campaign use.";
        }
        return "Content appears safe for campaign use.";
    }
}
