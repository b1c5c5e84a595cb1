package com.canary.intel.learning;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds the configured insight phrases ("false alarm", "should have noticed"...) in a
 * feedback comment. Matching is case-insensitive and whitespace-tolerant.
 */
public class CommentInsightExtractor {

    private static final int CONTEXT_LENGTH = 100;

    private final List<String> phrases;

    public CommentInsightExtractor(List<String> phrases) {
        this.phrases = new ArrayList<>();
        for (String phrase : phrases) {
            String normalized = collapse(phrase);
            if (!normalized.isEmpty() && !this.phrases.contains(normalized)) {
                this.phrases.add(normalized);
            }
        }
    }

    /**
     * Configured phrases found in the comment, in configuration order.
     */
    public List<String> extract(String comment) {
        List<String> found = new ArrayList<>();
        if (comment == null || comment.isBlank()) {
            return found;
        }
        String text = collapse(comment);
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                found.add(phrase);
            }
        }
        return found;
    }

    /**
     * Leading part of the comment stored alongside each insight.
     */
    public static String context(String comment) {
        String trimmed = comment.strip();
        return trimmed.length() <= CONTEXT_LENGTH ? trimmed : trimmed.substring(0, CONTEXT_LENGTH);
    }

    private static String collapse(String text) {
        return String.join(" ", text.toLowerCase(Locale.ROOT).trim().split("\\s+"));
    }
}
