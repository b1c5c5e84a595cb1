package com.canary.intel.learning;

import com.canary.core.config.KeywordSettings;
import com.canary.core.config.PatternSettings;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Case-folded, stopword-filtered terms of a headline plus any multi-word watch phrases.
 */
public class KeywordExtractor {

    private final int minTermLength;
    private final Set<String> stopwords;
    private final List<String> phrases;

    public KeywordExtractor(KeywordSettings keywords, PatternSettings patterns) {
        this.minTermLength = keywords.getMinTermLength();
        this.stopwords = new HashSet<>();
        for (String s : keywords.getStopwords()) {
            stopwords.add(s.toLowerCase(Locale.ROOT));
        }
        this.phrases = new ArrayList<>();
        for (String term : patterns.getWatchTerms()) {
            if (TextTerms.words(term).size() > 1) {
                phrases.add(term.toLowerCase(Locale.ROOT));
            }
        }
    }

    /**
     * Distinct terms in order of first appearance, phrases last.
     */
    public List<String> extract(String headline) {
        List<String> words = TextTerms.words(headline);
        Set<String> terms = new LinkedHashSet<>();

        for (String w : words) {
            if (w.length() >= minTermLength && !stopwords.contains(w) && !isNumber(w)) {
                terms.add(w);
            }
        }
        for (String phrase : phrases) {
            if (TextTerms.containsPhrase(words, phrase)) {
                terms.add(phrase);
            }
        }
        return new ArrayList<>(terms);
    }

    private static boolean isNumber(String word) {
        return word.chars().allMatch(Character::isDigit);
    }
}
