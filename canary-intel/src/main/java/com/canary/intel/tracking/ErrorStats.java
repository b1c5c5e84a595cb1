package com.canary.intel.tracking;

/**
 * Mean absolute error over a set of realized predictions.
 */
public record ErrorStats(int count, double meanAbsoluteError) {

    public static ErrorStats empty() {
        return new ErrorStats(0, 0.0);
    }
}
