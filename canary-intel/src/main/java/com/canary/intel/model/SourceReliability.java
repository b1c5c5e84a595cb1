package com.canary.intel.model;

import java.time.Instant;

/**
 * How closely predictions for a source matched what users reported.
 * {@code decayedAt} is the last time a maintenance pass persisted decay
 * toward neutral; null if never.
 */
public record SourceReliability(
    String source,
    String contentType,
    double reliability,     // 0-1, 0.5 is neutral
    double sampleCount,
    Instant lastUpdated,
    Instant decayedAt
) {}
