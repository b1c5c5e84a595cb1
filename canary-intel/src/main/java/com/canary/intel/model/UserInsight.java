package com.canary.intel.model;

import java.time.Instant;

/**
 * A phrase from a feedback comment that says how the user judged the urgency,
 * kept together with the urgency they gave.
 */
public record UserInsight(
    FeedbackRecord.FeedbackKind kind,
    String feedbackKey,
    String phrase,
    String context,             // First 100 characters of the comment
    double correctedUrgency,
    double effectiveness,       // correctedUrgency / 10
    Instant createdAt
) {}
