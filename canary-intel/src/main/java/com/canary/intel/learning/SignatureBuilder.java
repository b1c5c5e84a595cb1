package com.canary.intel.learning;

import com.canary.core.config.PatternSettings;

import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Reduces a headline to its {@link HeadlineSignature}.
 * Two headlines with the same urgency markers, the same watch-list terms and the
 * same shape share a signature regardless of the remaining words.
 */
public class SignatureBuilder {

    private final PatternSettings settings;

    public SignatureBuilder(PatternSettings settings) {
        this.settings = settings;
    }

    public HeadlineSignature build(String headline) {
        String text = headline == null ? "" : headline;
        List<String> words = TextTerms.words(text);
        String lower = text.toLowerCase(Locale.ROOT);

        TreeSet<String> markers = new TreeSet<>();
        for (String marker : settings.getUrgencyMarkers()) {
            String m = marker.toLowerCase(Locale.ROOT);
            boolean symbolic = TextTerms.words(m).isEmpty();
            if (symbolic ? lower.contains(m) : words.contains(m)) {
                markers.add(m);
            }
        }

        TreeSet<String> watch = new TreeSet<>();
        for (String term : settings.getWatchTerms()) {
            if (TextTerms.containsPhrase(words, term)) {
                watch.add(term.toLowerCase(Locale.ROOT));
            }
        }

        String coarse = markers.isEmpty() && watch.isEmpty()
            ? ""
            : "m=" + String.join(",", markers) + "|w=" + String.join(",", watch);

        String signature = "m=" + String.join(",", markers)
            + "|w=" + String.join(",", watch)
            + "|len=" + lengthBucket(words.size())
            + "|num=" + flag(text.chars().anyMatch(Character::isDigit))
            + "|quote=" + flag(text.indexOf('"') >= 0 || text.indexOf('“') >= 0)
            + "|colon=" + flag(text.indexOf(':') >= 0)
            + "|caps=" + flag(hasShoutedWord(text));

        return new HeadlineSignature(signature, coarse);
    }

    private static String lengthBucket(int wordCount) {
        if (wordCount <= 6) return "short";
        if (wordCount <= 12) return "medium";
        return "long";
    }

    private static int flag(boolean value) {
        return value ? 1 : 0;
    }

    // Any all-caps word of two or more letters, e.g. "BREAKING"
    private static boolean hasShoutedWord(String text) {
        for (String token : text.split("\\s+")) {
            String letters = token.replaceAll("[^\\p{L}]", "");
            if (letters.length() >= 2 && letters.equals(letters.toUpperCase(Locale.ROOT))
                    && !letters.equals(letters.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
