package com.canary.intel.model;

import java.time.Instant;

/**
 * A stored prediction. {@code realizedScore} and {@code error} stay null until
 * matching feedback arrives.
 */
public record PredictionRecord(
    String predictionId,
    String headline,
    String source,
    String contentType,
    String inputsSnapshot,      // JSON of the headline and economic snapshot
    double predictedScore,
    boolean fallbackUsed,
    Instant predictedAt,
    Double realizedScore,
    Double error,               // |predicted - realized|
    Instant realizedAt
) {
    public boolean isRealized() {
        return realizedScore != null;
    }
}
