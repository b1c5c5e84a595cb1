package com.canary.intel.model;

import java.time.Instant;

/**
 * User feedback from one of the two channels.
 */
public sealed interface FeedbackRecord permits DigestFeedback, ArticleFeedback {

    /**
     * Identity used for duplicate detection within the channel.
     */
    String feedbackKey();

    String comment();

    Instant createdAt();

    FeedbackKind kind();

    enum FeedbackKind {
        DIGEST,
        ARTICLE
    }
}
