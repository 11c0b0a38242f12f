package dev.contentscanner.service;

import dev.contentscanner.config.AnalysisConfig;
import dev.contentscanner.model.SafetyStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Maps risk scores to verdicts using the configured warning and reject thresholds.
 */
@Service
@RequiredArgsConstructor
public class ScoreClassifier {

    private final AnalysisConfig analysisConfig;

    public SafetyStatus classify(String category, double score) {
        if (score >= analysisConfig.rejectThresholdFor(category)) {
            return SafetyStatus.REJECTED;
        }
        if (score >= analysisConfig.warningThresholdFor(category)) {
            return SafetyStatus.WARNING;
        }
        return SafetyStatus.SAFE;
    }

    /**
     * Worst verdict over all reported scores. Missing (null) scores are ignored.
     */
    public SafetyStatus classifyAll(Map<String, Double> scores) {
        SafetyStatus worst = SafetyStatus.SAFE;
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            if (entry.getValue() != null) {
                worst = SafetyStatus.worst(worst, classify(entry.getKey(), entry.getValue()));
            }
        }
        return worst;
    }
}
