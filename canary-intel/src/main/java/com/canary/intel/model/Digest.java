package com.canary.intel.model;

import java.time.Instant;
import java.util.List;

/**
 * A delivered digest, registered so whole-digest ratings can reach its headlines.
 */
public record Digest(
    String digestId,
    double predictedScore,
    List<DigestHeadline> headlines,
    Instant createdAt
) {
    public Digest {
        headlines = headlines == null ? List.of() : List.copyOf(headlines);
    }
}
