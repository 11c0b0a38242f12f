package dev.contentscanner.scheduler;

import dev.contentscanner.config.AnalysisConfig;
import dev.contentscanner.model.Job;
import dev.contentscanner.model.JobStatus;
import dev.contentscanner.repository.JobRepository;
import dev.contentscanner.service.JobOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Reprocesses jobs left PENDING or IN_PROGRESS past the staleness threshold,
 * e.g. after a crash between dispatch and completion. A job that already used
 * {@code analysis.recovery.max-attempts} attempts is expired instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "analysis.recovery.enabled", havingValue = "true", matchIfMissing = true)
public class StaleJobRecoveryScheduler {

    private static final List<JobStatus> RECOVERABLE = List.of(JobStatus.PENDING, JobStatus.IN_PROGRESS);

    private final JobRepository jobRepository;
    private final JobOrchestrator jobOrchestrator;
    private final AnalysisConfig analysisConfig;

    @Scheduled(fixedDelayString = "${analysis.recovery.interval-ms:60000}",
            initialDelayString = "${analysis.recovery.interval-ms:60000}")
    public void recoverStaleJobs() {
        int recovered = recover(Instant.now().minus(analysisConfig.getRecovery().getStaleAfter()));
        if (recovered > 0) {
            log.info("[Recovery] Recovered {} stale job(s)", recovered);
        }
    }

    /**
     * Reprocess or expire every recoverable job not updated since the cutoff.
     *
     * @return number of jobs reprocessed or expired without error
     */
    public int recover(Instant cutoff) {
        List<String> staleIds = jobRepository.findStale(RECOVERABLE, cutoff);
        if (staleIds.isEmpty()) {
            log.debug("[Recovery] No stale jobs");
            return 0;
        }
        log.warn("[Recovery] Found {} stale job(s) not updated since {}", staleIds.size(), cutoff);

        Long recovered = Flux.fromIterable(staleIds)
                .concatMap(jobId -> recoverJob(jobId)
                        .thenReturn(1)
                        .onErrorResume(e -> {
                            log.error("[Recovery] Recovery of job {} failed: {}", jobId, e.getMessage());
                            return Mono.empty();
                        }))
                .count()
                .block();
        return recovered == null ? 0 : recovered.intValue();
    }

    private Mono<Void> recoverJob(String jobId) {
        return Mono.defer(() -> {
            Job job = jobRepository.get(jobId);
            int maxAttempts = analysisConfig.getRecovery().getMaxAttempts();
            if (job.getAttempt() + 1 >= maxAttempts) {
                log.error("[Recovery] Job {} is still {} after {} attempt(s), expiring it",
                        jobId, job.getStatus(), job.getAttempt() + 1);
                return jobOrchestrator.expire(jobId,
                        String.format("Analysis did not complete after %d attempt(s)", job.getAttempt() + 1));
            }
            return jobOrchestrator.reprocess(jobId);
        });
    }
}
