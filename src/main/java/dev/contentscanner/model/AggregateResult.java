package dev.contentscanner.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Campaign-level fold of all media outcomes.
 *
 * @param categories       category to post-weighted mean score; null when the category was reported without a value
 * @param overallScore     mean of the category scores that have a value, null when none has
 * @param categoryStatuses verdict for each category that has a score
 * @param explanations     optional reviewer hints per category
 * @param status           worst post status, ERRORED when no media produced a result
 * @param analyzed         media scored through the provider or the cache
 * @param skipped          media classified SAFE by the known-safe pre-check
 * @param errored          media that ended with a {@link MediaError}
 * @param posts            per-post breakdown in submission order
 */
public record AggregateResult(
        Map<String, Double> categories,
        Double overallScore,
        Map<String, SafetyStatus> categoryStatuses,
        Map<String, String> explanations,
        SafetyStatus status,
        int analyzed,
        int skipped,
        int errored,
        List<PostResult> posts) {

    public AggregateResult {
        categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories == null ? Map.of() : categories));
        categoryStatuses = Collections.unmodifiableMap(
                new LinkedHashMap<>(categoryStatuses == null ? Map.of() : categoryStatuses));
        explanations = Collections.unmodifiableMap(new LinkedHashMap<>(explanations == null ? Map.of() : explanations));
        posts = posts == null ? List.of() : List.copyOf(posts);
    }

    public int total() {
        return analyzed + skipped + errored;
    }

    public boolean hasUsableScores() {
        return analyzed + skipped > 0;
    }
}
