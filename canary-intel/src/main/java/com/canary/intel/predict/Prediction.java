package com.canary.intel.predict;

import com.canary.core.model.UrgencyLevel;

/**
 * Result of {@link PredictionEngine#predict}.
 *
 * @param predictionId id of the stored prediction record; feedback quoting it is matched exactly
 * @param recorded     false if the record could not be stored
 */
public record Prediction(
    String predictionId,
    double score,
    UrgencyLevel urgencyLevel,
    Explanation explanation,
    boolean recorded
) {}
