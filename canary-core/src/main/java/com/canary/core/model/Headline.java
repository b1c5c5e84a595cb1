package com.canary.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * A single headline handed over by the collector.
 * Ordering of headlines carries no meaning for scoring.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Headline(
    String title,           // Original headline text
    String source,          // "Reuters", "https://www.npr.org/...", "reddit r/economics"
    String url,             // Link to the article (may be null)
    String contentType,     // "news", "economic", "social"
    Instant publishedAt     // Publish time if known
) {
    public static final String DEFAULT_CONTENT_TYPE = "news";

    public static Headline of(String title, String source) {
        return new Headline(title, source, null, DEFAULT_CONTENT_TYPE, null);
    }

    public static Headline of(String title, String source, String contentType) {
        return new Headline(title, source, null, contentType, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String title;
        private String source;
        private String url;
        private String contentType = DEFAULT_CONTENT_TYPE;
        private Instant publishedAt;

        public Builder title(String title) { this.title = title; return this; }
        public Builder source(String source) { this.source = source; return this; }
        public Builder url(String url) { this.url = url; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder publishedAt(Instant publishedAt) { this.publishedAt = publishedAt; return this; }

        public Headline build() {
            return new Headline(title, source, url, contentType, publishedAt);
        }
    }
}
