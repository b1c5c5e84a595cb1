package com.canary.intel.model;

import java.time.Instant;

/**
 * A headline the user says was flagged urgent but was not.
 */
public record FalsePositive(
    String headline,
    String reason,
    Double predictedUrgency,
    Instant reportedAt
) {}
