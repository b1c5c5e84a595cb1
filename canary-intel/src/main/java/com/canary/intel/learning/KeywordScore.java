package com.canary.intel.learning;

import java.util.List;

/**
 * Keyword evidence for a headline.
 *
 * @param score        sample-weighted mean weight of the known terms, 0-10
 * @param confidence   saturating function of the total samples behind those terms
 * @param matchedTerms known terms that contributed
 */
public record KeywordScore(double score, double confidence, double totalSamples, List<String> matchedTerms) {

    public static KeywordScore none() {
        return new KeywordScore(0.0, 0.0, 0.0, List.of());
    }

    public boolean hasEvidence() {
        return totalSamples > 0;
    }
}
