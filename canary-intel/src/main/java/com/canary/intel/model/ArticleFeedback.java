package com.canary.intel.model;

import java.time.Instant;

/**
 * A rating (or an "irrelevant" mark) for a single article.
 * Exactly one of {@code rating} and {@code irrelevant} is set on valid input.
 */
public record ArticleFeedback(
    String articleId,
    String headline,
    String source,
    String contentType,
    Double rating,          // 0-10, null when marked irrelevant
    boolean irrelevant,
    String comment,
    Double aiScore,         // Score the user was shown, if any
    String predictionId,    // Prediction that produced aiScore, if known
    Instant createdAt
) implements FeedbackRecord {

    @Override
    public String feedbackKey() {
        return articleId;
    }

    @Override
    public FeedbackKind kind() {
        return FeedbackKind.ARTICLE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String articleId;
        private String headline;
        private String source;
        private String contentType = "news";
        private Double rating;
        private boolean irrelevant;
        private String comment;
        private Double aiScore;
        private String predictionId;
        private Instant createdAt;

        public Builder articleId(String articleId) { this.articleId = articleId; return this; }
        public Builder headline(String headline) { this.headline = headline; return this; }
        public Builder source(String source) { this.source = source; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder rating(Double rating) { this.rating = rating; return this; }
        public Builder irrelevant(boolean irrelevant) { this.irrelevant = irrelevant; return this; }
        public Builder comment(String comment) { this.comment = comment; return this; }
        public Builder aiScore(Double aiScore) { this.aiScore = aiScore; return this; }
        public Builder predictionId(String predictionId) { this.predictionId = predictionId; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }

        public ArticleFeedback build() {
            return new ArticleFeedback(articleId, headline, source, contentType, rating, irrelevant,
                comment, aiScore, predictionId, createdAt);
        }
    }
}
