package com.canary.intel.predict;

import java.util.List;

/**
 * Why a prediction came out the way it did.
 *
 * @param insufficientDataFallback neither learned signal fired, so the score is the fallback
 * @param storageDegraded          a storage failure forced learned signals to be skipped
 */
public record Explanation(
    SignalContribution pattern,
    SignalContribution keywords,
    double sourceReliability,
    double trustFactor,
    double fallbackScore,
    FallbackSource fallbackSource,
    double fallbackWeight,
    boolean insufficientDataFallback,
    double economicAdjustment,
    boolean storageDegraded,
    List<String> notes
) {
    public Explanation {
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
