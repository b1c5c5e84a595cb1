package com.canary.intel.learning;

import com.canary.intel.model.Pattern;

/**
 * A pattern matched against a headline.
 *
 * @param confidence the pattern's confidence, scaled down for near matches
 * @param exact      true if the full signature matched, false for a coarse-key match
 */
public record PatternMatch(Pattern pattern, double confidence, boolean exact) {

    public double derivedUrgency() {
        return pattern.derivedUrgency();
    }
}
