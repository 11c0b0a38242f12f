package dev.contentscanner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Tuning for media analysis, aggregation and job recovery.
 * Loaded from application.yml under 'analysis' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "analysis")
public class AnalysisConfig {

    private Duration moderationTimeout = Duration.ofSeconds(10);
    private int retryLimit = 2;
    private Duration retryBackoff = Duration.ofMillis(500);

    private double warningThreshold = 0.3;
    private double rejectThreshold = 0.7;

    // Optional overrides keyed by category name
    private Map<String, CategoryThreshold> categoryThresholds = new HashMap<>();

    private int workerConcurrency = 4;
    private int maxRedeliveries = 3;

    private boolean summaryEnabled = true;
    private Duration summaryTimeout = Duration.ofSeconds(15);

    private Set<String> knownSafeFingerprints = new HashSet<>();

    private Cache cache = new Cache();
    private Recovery recovery = new Recovery();

    public double warningThresholdFor(String category) {
        CategoryThreshold override = categoryThresholds.get(category);
        return override != null && override.getWarning() != null ? override.getWarning() : warningThreshold;
    }

    public double rejectThresholdFor(String category) {
        CategoryThreshold override = categoryThresholds.get(category);
        return override != null && override.getReject() != null ? override.getReject() : rejectThreshold;
    }

    @Data
    public static class CategoryThreshold {
        private Double warning;
        private Double reject;
    }

    @Data
    public static class Cache {
        private long maxSize = 10_000;
        private Duration ttl = Duration.ofHours(24);
    }

    @Data
    public static class Recovery {
        private boolean enabled = true;
        private Duration staleAfter = Duration.ofMinutes(15);
        // Attempts per job, the first run included, before recovery gives up on it
        private int maxAttempts = 3;
    }
}
