package com.canary.intel.learning;

/**
 * Structural fingerprint of a headline.
 *
 * @param signature full key: markers, watch terms, length bucket and shape flags
 * @param coarseKey markers and watch terms only; empty when the headline has neither
 */
public record HeadlineSignature(String signature, String coarseKey) {

    public boolean hasCoarseKey() {
        return coarseKey != null && !coarseKey.isEmpty();
    }
}
