package com.canary.intel.predict;

import com.canary.core.model.EconomicSnapshot;
import com.canary.core.model.Headline;

/**
 * Input to one prediction.
 *
 * @param externalScore score from an outside model (0-10), or null
 */
public record PredictionRequest(Headline headline, EconomicSnapshot economicSnapshot, Double externalScore) {

    public PredictionRequest {
        if (economicSnapshot == null) {
            economicSnapshot = EconomicSnapshot.empty();
        }
    }

    public static PredictionRequest of(Headline headline) {
        return new PredictionRequest(headline, EconomicSnapshot.empty(), null);
    }
}
