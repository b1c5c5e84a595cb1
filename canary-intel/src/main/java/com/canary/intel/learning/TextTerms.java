package com.canary.intel.learning;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Case-folded word splitting and watch-phrase matching shared by signatures and keywords.
 */
final class TextTerms {

    private TextTerms() {}

    /**
     * Lower-cased alphanumeric words in order of appearance.
     */
    static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        if (text == null) {
            return words;
        }
        for (String w : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!w.isEmpty()) {
                words.add(w);
            }
        }
        return words;
    }

    /**
     * A multi-word phrase matches as a whole-word sequence; a single word also matches
     * as a prefix ("impeach" matches "impeachment").
     */
    static boolean containsPhrase(List<String> words, String phrase) {
        List<String> parts = words(phrase);
        if (parts.isEmpty()) {
            return false;
        }
        if (parts.size() == 1) {
            String term = parts.get(0);
            for (String w : words) {
                if (w.startsWith(term)) return true;
            }
            return false;
        }
        outer:
        for (int i = 0; i + parts.size() <= words.size(); i++) {
            for (int j = 0; j < parts.size(); j++) {
                if (!words.get(i + j).equals(parts.get(j))) continue outer;
            }
            return true;
        }
        return false;
    }
}
