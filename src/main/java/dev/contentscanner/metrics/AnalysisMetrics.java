package dev.contentscanner.metrics;

import dev.contentscanner.model.ErrorKind;
import dev.contentscanner.model.JobStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for content analysis jobs.
 */
@Component
public class AnalysisMetrics {

    private static final String TAG_PROVIDER = "provider";
    private final MeterRegistry registry;

    // Counters
    private final Counter jobsSubmittedCounter;
    private final Counter mediaAnalyzedCounter;
    private final Counter mediaSkippedCounter;
    private final Counter mediaErroredCounter;
    private final Counter cacheHitsCounter;
    private final Counter cacheMissesCounter;
    private final Counter summaryFailuresCounter;
    private final Counter versionConflictsCounter;

    // Timers (per provider)
    private final ConcurrentHashMap<String, Timer> providerTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger jobsInFlight = new AtomicInteger(0);

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.jobsSubmittedCounter = Counter.builder("content_scanner_jobs_submitted_total")
                .description("Total analysis jobs accepted")
                .register(registry);

        this.mediaAnalyzedCounter = Counter.builder("content_scanner_media_analyzed_total")
                .description("Media items scored by a provider or the cache")
                .register(registry);

        this.mediaSkippedCounter = Counter.builder("content_scanner_media_skipped_total")
                .description("Media items classified safe without a provider call")
                .register(registry);

        this.mediaErroredCounter = Counter.builder("content_scanner_media_errored_total")
                .description("Media items that ended with an error")
                .register(registry);

        this.cacheHitsCounter = Counter.builder("content_scanner_cache_hits_total")
                .description("Result cache hits")
                .register(registry);

        this.cacheMissesCounter = Counter.builder("content_scanner_cache_misses_total")
                .description("Result cache misses")
                .register(registry);

        this.summaryFailuresCounter = Counter.builder("content_scanner_summary_failures_total")
                .description("Summaries that failed or timed out")
                .register(registry);

        this.versionConflictsCounter = Counter.builder("content_scanner_version_conflicts_total")
                .description("Conditional job updates that lost a race")
                .register(registry);

        Gauge.builder("content_scanner_jobs_in_flight", jobsInFlight, AtomicInteger::get)
                .description("Jobs dispatched and not yet terminal in this process")
                .register(registry);
    }

    /**
     * Get or create a latency timer for a provider.
     */
    public Timer getProviderTimer(String provider) {
        return providerTimers.computeIfAbsent(provider, name ->
                Timer.builder("content_scanner_provider_call_duration")
                        .description("Latency of provider calls")
                        .tag(TAG_PROVIDER, name)
                        .register(registry));
    }

    public void recordJobSubmitted() {
        jobsSubmittedCounter.increment();
        jobsInFlight.incrementAndGet();
    }

    /**
     * Record a job reaching a terminal status.
     */
    public void recordJobFinished(JobStatus status) {
        jobsInFlight.updateAndGet(current -> Math.max(0, current - 1));
        Counter.builder("content_scanner_jobs_finished_total")
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    public void recordMediaAnalyzed() {
        mediaAnalyzedCounter.increment();
    }

    public void recordMediaSkipped() {
        mediaSkippedCounter.increment();
    }

    public void recordMediaErrored(ErrorKind kind) {
        mediaErroredCounter.increment();
        Counter.builder("content_scanner_media_errors_by_kind_total")
                .tag("kind", kind.name())
                .register(registry)
                .increment();
    }

    public void recordCacheHit() {
        cacheHitsCounter.increment();
    }

    public void recordCacheMiss() {
        cacheMissesCounter.increment();
    }

    public void recordSummaryFailure() {
        summaryFailuresCounter.increment();
    }

    public void recordVersionConflict() {
        versionConflictsCounter.increment();
    }

    public void recordProviderLatency(String provider, Duration latency) {
        getProviderTimer(provider).record(latency);
    }
}
