package com.canary.intel.predict;

import com.canary.core.model.EconomicSnapshot;
import com.canary.core.model.Headline;

import java.util.OptionalDouble;

/**
 * Outside scoring model consulted only when learned signals are insufficient.
 */
@FunctionalInterface
public interface FallbackScoreProvider {

    /**
     * A 0-10 score for the headline, or empty if the model has no opinion.
     */
    OptionalDouble score(Headline headline, EconomicSnapshot snapshot);
}
