package com.canary.intel.model;

import java.time.Instant;

/**
 * A row moved out of its table because it violated its own invariants.
 */
public record QuarantinedRecord(
    String tableName,
    String recordKey,
    String payload,         // JSON of the original row
    String reason,
    Instant detectedAt
) {}
