package com.canary.intel.model;

import com.canary.core.model.Scores;

import java.time.Instant;

/**
 * A learned structural pattern. The signature is a normalized fingerprint of a
 * headline's shape, never its raw text.
 */
public record Pattern(
    String signature,
    String coarseKey,           // Watch terms + urgency markers only, for near matches
    double sampleUrgencySum,    // Sum of observed urgency * weight multiplier
    double sampleCount,         // Sum of weight multipliers
    double confidence,          // 0-1, grows with sampleCount up to the ceiling
    Instant lastUpdated
) {
    /**
     * Average observed urgency, clamped to 0-10.
     */
    public double derivedUrgency() {
        if (sampleCount <= 0) {
            return Scores.MIN_URGENCY;
        }
        return Scores.clampUrgency(sampleUrgencySum / sampleCount);
    }
}
