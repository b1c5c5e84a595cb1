package com.canary.core.error;

/**
 * Feedback for a digest or article that was already ingested.
 */
public class DuplicateFeedbackException extends IntelException {

    private final String feedbackKey;

    public DuplicateFeedbackException(String feedbackKey) {
        super("Feedback already recorded for " + feedbackKey);
        this.feedbackKey = feedbackKey;
    }

    public String getFeedbackKey() {
        return feedbackKey;
    }

    @Override
    protected String defaultErrorCode() {
        return "ERR-DUP";
    }
}
