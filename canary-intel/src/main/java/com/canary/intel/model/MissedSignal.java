package com.canary.intel.model;

import java.time.Instant;

/**
 * An event the system should have flagged but did not.
 */
public record MissedSignal(
    String description,
    String details,
    Double actualUrgency,
    Instant reportedAt
) {}
