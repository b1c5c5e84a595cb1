package com.canary.intel.model;

/**
 * Classification stored with every feedback record.
 */
public enum FeedbackType {
    // Digest channel
    ACCURATE,
    INACCURATE,

    // Article channel
    AI_OVERRATED,           // User <= 3, AI >= 7
    AI_UNDERRATED,          // User >= 7, AI <= 3
    REASONABLE_MATCH,       // Within 2 points
    SIGNIFICANT_DIFFERENCE,
    IRRELEVANT,
    UNSCORED;               // No AI score to compare against

    public static FeedbackType forDigest(double predicted, double rating) {
        return Math.abs(predicted - rating) <= 1.0 ? ACCURATE : INACCURATE;
    }

    public static FeedbackType forArticle(double rating, Double aiScore) {
        if (aiScore == null) return UNSCORED;
        if (rating <= 3 && aiScore >= 7) return AI_OVERRATED;
        if (rating >= 7 && aiScore <= 3) return AI_UNDERRATED;
        if (Math.abs(rating - aiScore) <= 2) return REASONABLE_MATCH;
        return SIGNIFICANT_DIFFERENCE;
    }
}
