package dev.contentscanner.service;

import dev.contentscanner.model.AggregateResult;
import dev.contentscanner.model.Job;
import dev.contentscanner.model.Media;
import dev.contentscanner.model.MediaResult;
import dev.contentscanner.model.Post;
import dev.contentscanner.model.PostResult;
import dev.contentscanner.model.SafetyStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Folds media outcomes into post-level and campaign-level results.
 * <p>
 * Pure: no I/O, no mutation of the job. A media item only contributes to the
 * mean of the categories it actually scored; errored media and null scores are
 * left out of the denominator. At campaign level every post weighs the same,
 * whatever its number of media items.
 */
@Service
@RequiredArgsConstructor
public class AggregationEngine {

    static final String SPOOF_CATEGORY = "spoof_fake";
    static final String SPOOF_EXPLANATION =
            "Potential spoof or manipulated content detected. Manual review recommended.";
    static final String NO_DATA_EXPLANATION = "No valid data available";

    private final ScoreClassifier scoreClassifier;

    public AggregateResult aggregate(Job job) {
        List<PostResult> postResults = job.getPosts().stream()
                .map(this::aggregatePost)
                .toList();

        Set<String> observed = new TreeSet<>();
        Map<String, List<Double>> postMeans = new TreeMap<>();
        SafetyStatus overall = SafetyStatus.ERRORED;
        int analyzed = 0;
        int skipped = 0;
        int errored = 0;

        for (PostResult post : postResults) {
            post.categories().forEach((category, mean) -> {
                observed.add(category);
                if (mean != null) {
                    postMeans.computeIfAbsent(category, key -> new ArrayList<>()).add(mean);
                }
            });
            overall = SafetyStatus.worst(overall, post.status());
            analyzed += post.analyzed();
            skipped += post.skipped();
            errored += post.errored();
        }

        Map<String, Double> categories = new LinkedHashMap<>();
        Map<String, SafetyStatus> categoryStatuses = new LinkedHashMap<>();
        Map<String, String> explanations = new LinkedHashMap<>();
        for (String category : observed) {
            Double score = mean(postMeans.get(category));
            categories.put(category, score);
            if (score == null) {
                explanations.put(category, NO_DATA_EXPLANATION);
                continue;
            }
            SafetyStatus status = scoreClassifier.classify(category, score);
            categoryStatuses.put(category, status);
            if (SPOOF_CATEGORY.equals(category) && status != SafetyStatus.SAFE) {
                explanations.put(category, SPOOF_EXPLANATION);
            }
        }

        List<Double> scored = categories.values().stream()
                .filter(Objects::nonNull)
                .toList();

        return new AggregateResult(categories, mean(scored), categoryStatuses, explanations, overall,
                analyzed, skipped, errored, postResults);
    }

    PostResult aggregatePost(Post post) {
        Set<String> observed = new TreeSet<>();
        Map<String, List<Double>> scores = new TreeMap<>();
        SafetyStatus status = SafetyStatus.ERRORED;
        int analyzed = 0;
        int skipped = 0;
        int errored = 0;

        for (Media media : post.media()) {
            if (media.error() != null) {
                errored++;
                continue;
            }
            MediaResult result = media.result();
            if (result == null) {
                continue;
            }
            if (result.skipped()) {
                skipped++;
            } else {
                analyzed++;
            }
            status = SafetyStatus.worst(status, result.status());
            result.scores().forEach((category, score) -> {
                observed.add(category);
                if (score != null) {
                    scores.computeIfAbsent(category, key -> new ArrayList<>()).add(score);
                }
            });
        }

        Map<String, Double> categories = new LinkedHashMap<>();
        for (String category : observed) {
            categories.put(category, mean(scores.get(category)));
        }
        return new PostResult(post.postId(), categories, status, analyzed, skipped, errored);
    }

    private static Double mean(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }
}
