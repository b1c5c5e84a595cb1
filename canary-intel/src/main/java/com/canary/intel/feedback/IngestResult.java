package com.canary.intel.feedback;

import com.canary.intel.model.FeedbackType;

/**
 * Outcome of ingesting one feedback record.
 *
 * @param reason           why it was rejected, null when applied
 * @param headlinesApplied headlines whose learned state was updated
 * @param feedbackType     classification stored with the record, null when rejected
 */
public record IngestResult(
    String feedbackKey,
    IngestStatus status,
    String reason,
    int headlinesApplied,
    FeedbackType feedbackType
) {
    public static IngestResult applied(String key, int headlines, FeedbackType type) {
        return new IngestResult(key, IngestStatus.APPLIED, null, headlines, type);
    }

    public static IngestResult duplicate(String key) {
        return new IngestResult(key, IngestStatus.REJECTED_DUPLICATE, "already ingested", 0, null);
    }

    public static IngestResult invalid(String key, String reason) {
        return new IngestResult(key, IngestStatus.REJECTED_INVALID, reason, 0, null);
    }

    public boolean isApplied() {
        return status == IngestStatus.APPLIED;
    }
}
