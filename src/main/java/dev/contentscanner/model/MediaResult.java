package dev.contentscanner.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Moderation scores for one media item.
 * <p>
 * A category mapped to {@code null} was requested but not reported by the provider.
 * Such values stay {@code null}; they are never coerced to zero.
 *
 * @param scores             category name to risk score in [0.0, 1.0], values may be null
 * @param status             worst category verdict against the configured thresholds
 * @param contentFingerprint stable hash of the media reference, used as cache key
 * @param skipped            true when the provider call was skipped by the known-safe pre-check
 */
public record MediaResult(
        Map<String, Double> scores,
        SafetyStatus status,
        String contentFingerprint,
        boolean skipped) {

    public MediaResult {
        Objects.requireNonNull(status, "status");
        if (status == SafetyStatus.ERRORED) {
            throw new IllegalArgumentException("A media result cannot be ERRORED");
        }
        if (contentFingerprint == null || contentFingerprint.isBlank()) {
            throw new IllegalArgumentException("contentFingerprint is required");
        }
        Map<String, Double> copy = new LinkedHashMap<>();
        if (scores != null) {
            scores.forEach((category, score) -> {
                if (score != null && (score.isNaN() || score < 0.0 || score > 1.0)) {
                    throw new IllegalArgumentException(
                            "Score for '" + category + "' out of range [0,1]: " + score);
                }
                copy.put(category, score);
            });
        }
        scores = Collections.unmodifiableMap(copy);
    }

    public static MediaResult knownSafe(String contentFingerprint) {
        return new MediaResult(Map.of(), SafetyStatus.SAFE, contentFingerprint, true);
    }
}
