package com.canary.intel.model;

import java.time.Instant;

/**
 * One rating for a whole digest.
 */
public record DigestFeedback(
    String digestId,
    double rating,
    String comment,
    Instant createdAt
) implements FeedbackRecord {

    @Override
    public String feedbackKey() {
        return digestId;
    }

    @Override
    public FeedbackKind kind() {
        return FeedbackKind.DIGEST;
    }
}
