package com.canary.intel.learning;

import java.net.URI;
import java.util.Locale;

/**
 * Canonical source names. "https://www.npr.org/2024/..." and "npr.org" both become
 * "npr.org"; "Reddit r/Economics" becomes "reddit_r/economics".
 */
public final class SourceNames {

    private SourceNames() {}

    public static String normalize(String source) {
        if (source == null) {
            return "";
        }
        String trimmed = source.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            String host = hostOf(trimmed);
            if (host != null) {
                return stripWww(host.toLowerCase(Locale.ROOT));
            }
        }
        return stripWww(lower.replaceAll("\\s+", "_"));
    }

    public static String normalizeContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return "news";
        }
        return contentType.trim().toLowerCase(Locale.ROOT);
    }

    private static String hostOf(String url) {
        try {
            return URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String stripWww(String name) {
        return name.startsWith("www.") ? name.substring(4) : name;
    }
}
