package com.canary.intel.model;

import java.time.Instant;

/**
 * Running weighted average of the urgency observed for headlines containing a term.
 */
public record KeywordWeight(
    String term,
    double weight,          // 0-10
    double sampleCount,
    Instant lastUpdated
) {}
