package com.canary.core.model;

public enum UrgencyLevel {
    HIGH(7.0),      // Act now: alerts, emergency runs
    MEDIUM(4.0),    // Worth a closer look in the digest
    LOW(0.0);       // Background noise

    private final double threshold;

    UrgencyLevel(double threshold) {
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    /**
     * Band a 0-10 urgency score.
     */
    public static UrgencyLevel fromScore(double score) {
        if (score >= HIGH.threshold) return HIGH;
        if (score >= MEDIUM.threshold) return MEDIUM;
        return LOW;
    }
}
