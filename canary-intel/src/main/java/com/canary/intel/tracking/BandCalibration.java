package com.canary.intel.tracking;

/**
 * How predictions in one urgency band compared with what users reported.
 */
public record BandCalibration(int count, double meanPredicted, double meanRealized, double meanAbsoluteError) {}
