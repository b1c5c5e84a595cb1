package com.canary.intel.tracking;

import com.canary.core.model.UrgencyLevel;

import java.time.Instant;
import java.util.Map;

/**
 * Accuracy of realized predictions made since {@code since} (all time when null).
 *
 * @param calibration by band of the predicted score
 * @param perSource   by normalized source name, sorted
 * @param internal    predictions scored from learned signals
 * @param fallback    predictions that fell back to the external or neutral score
 */
public record AccuracyReport(
    Instant since,
    int realizedCount,
    double meanAbsoluteError,
    Map<UrgencyLevel, BandCalibration> calibration,
    Map<String, ErrorStats> perSource,
    ErrorStats internal,
    ErrorStats fallback
) {
    /**
     * Mean of {@code 1 - error/10}; 0 when nothing is realized.
     */
    public double accuracy() {
        return realizedCount == 0 ? 0.0 : 1.0 - meanAbsoluteError / 10.0;
    }
}
