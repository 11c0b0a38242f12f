package dev.contentscanner.ai;

import dev.contentscanner.model.AggregateResult;
import dev.contentscanner.model.SafetyStatus;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders aggregate results as plain text for summary providers.
 */
final class SummaryPrompts {

    private SummaryPrompts() {
    }

    static String describeCategories(AggregateResult result) {
        if (result.categories().isEmpty()) {
            return "- no category scores available";
        }
        StringBuilder lines = new StringBuilder();
        result.categories().forEach((category, score) -> {
            SafetyStatus status = result.categoryStatuses().get(category);
            lines.append("- ").append(category).append(": ")
                    .append(score == null ? "no data" : formatScore(score))
                    .append(status == null ? "" : " (" + status + ")");
            String explanation = result.explanations().get(category);
            if (explanation != null) {
                lines.append(" - ").append(explanation);
            }
            lines.append('\n');
        });
        return lines.toString().trim();
    }

    static List<String> flaggedCategories(AggregateResult result) {
        return result.categoryStatuses().entrySet().stream()
                .filter(entry -> entry.getValue() == SafetyStatus.WARNING || entry.getValue() == SafetyStatus.REJECTED)
                .map(Map.Entry::getKey)
                .toList();
    }

    static String formatScore(double score) {
        return String.format(Locale.ROOT, "%.2f", score);
    }
}
