package com.canary.intel.feedback;

import com.canary.intel.model.FeedbackType;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Feedback and learning progress at a glance.
 *
 * @param predictionAccuracy mean of {@code 1 - error/10} over realized predictions
 * @param recentByType       feedback received in the last 30 days by type
 * @param userInsights       insight phrases recorded from feedback comments
 */
public record FeedbackSummary(
    double predictionAccuracy,
    int realizedPredictions,
    int totalFeedback,
    Map<FeedbackType, Integer> recentByType,
    int falsePositives,
    int missedSignals,
    int userInsights,
    LearningStatus status
) {
    public FeedbackSummary {
        recentByType = Collections.unmodifiableMap(new TreeMap<>(recentByType));
    }

    public int recent(FeedbackType type) {
        return recentByType.getOrDefault(type, 0);
    }
}
