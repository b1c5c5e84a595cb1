package com.canary.core.model;

/**
 * Bounds shared by every urgency and reliability computation.
 */
public final class Scores {

    public static final double MIN_URGENCY = 0.0;
    public static final double MAX_URGENCY = 10.0;
    public static final double NEUTRAL_RELIABILITY = 0.5;

    private Scores() {}

    public static double clampUrgency(double value) {
        return clamp(value, MIN_URGENCY, MAX_URGENCY);
    }

    public static double clampUnit(double value) {
        return clamp(value, 0.0, 1.0);
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) return min;
        return Math.max(min, Math.min(max, value));
    }

    public static boolean isUrgency(double value) {
        return !Double.isNaN(value) && value >= MIN_URGENCY && value <= MAX_URGENCY;
    }
}
