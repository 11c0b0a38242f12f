package dev.contentscanner.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-post fold of media outcomes. Category means only count media that reported the category.
 */
public record PostResult(
        String postId,
        Map<String, Double> categories,
        SafetyStatus status,
        int analyzed,
        int skipped,
        int errored) {

    public PostResult {
        categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories == null ? Map.of() : categories));
    }
}
