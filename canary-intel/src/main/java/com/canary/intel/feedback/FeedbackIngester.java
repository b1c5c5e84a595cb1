package com.canary.intel.feedback;

import com.canary.core.config.LearningSettings;
import com.canary.core.error.DuplicateFeedbackException;
import com.canary.core.error.StorageUnavailableException;
import com.canary.core.error.ValidationException;
import com.canary.core.model.Headline;
import com.canary.core.model.Scores;
import com.canary.intel.learning.CommentInsightExtractor;
import com.canary.intel.learning.HeadlineSignature;
import com.canary.intel.learning.KeywordWeightTracker;
import com.canary.intel.learning.PatternMatch;
import com.canary.intel.learning.PatternStore;
import com.canary.intel.learning.SourceNames;
import com.canary.intel.learning.SourceReliabilityTracker;
import com.canary.intel.model.ArticleFeedback;
import com.canary.intel.model.Digest;
import com.canary.intel.model.DigestFeedback;
import com.canary.intel.model.DigestHeadline;
import com.canary.intel.model.FalsePositive;
import com.canary.intel.model.FeedbackRecord;
import com.canary.intel.model.FeedbackType;
import com.canary.intel.model.MissedSignal;
import com.canary.intel.model.Pattern;
import com.canary.intel.model.PredictionRecord;
import com.canary.intel.model.UserInsight;
import com.canary.intel.store.DigestRepo;
import com.canary.intel.store.ErrorReportRepo;
import com.canary.intel.store.FeedbackRepo;
import com.canary.intel.store.InsightRepo;
import com.canary.intel.store.IntelDatabase;
import com.canary.intel.tracking.AccuracyReport;
import com.canary.intel.tracking.PredictionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The only path by which feedback changes learned state.
 *
 * <p>Each ingestion is validated up front and then applied in a single transaction:
 * the feedback row and every tracker update commit together or not at all. A key
 * that was already ingested is rejected inside the transaction, which rolls back.</p>
 */
public class FeedbackIngester {

    private static final Logger log = LoggerFactory.getLogger(FeedbackIngester.class);

    private static final int SQLITE_CONSTRAINT = 19;
    private static final Duration RECENT = Duration.ofDays(30);

    private final IntelDatabase db;
    private final FeedbackRepo feedbackRepo;
    private final DigestRepo digestRepo;
    private final ErrorReportRepo errorReportRepo;
    private final InsightRepo insightRepo;
    private final PatternStore patterns;
    private final KeywordWeightTracker keywords;
    private final SourceReliabilityTracker sources;
    private final PredictionTracker predictions;
    private final LearningSettings settings;
    private final CommentInsightExtractor insights;

    public FeedbackIngester(IntelDatabase db, FeedbackRepo feedbackRepo, DigestRepo digestRepo,
                            ErrorReportRepo errorReportRepo, InsightRepo insightRepo, PatternStore patterns,
                            KeywordWeightTracker keywords, SourceReliabilityTracker sources,
                            PredictionTracker predictions, LearningSettings settings) {
        this.db = db;
        this.feedbackRepo = feedbackRepo;
        this.digestRepo = digestRepo;
        this.errorReportRepo = errorReportRepo;
        this.insightRepo = insightRepo;
        this.patterns = patterns;
        this.keywords = keywords;
        this.sources = sources;
        this.predictions = predictions;
        this.settings = settings;
        this.insights = new CommentInsightExtractor(settings.getInsightPhrases());
    }

    // ==================== Digests ====================

    /**
     * Register a delivered digest so a later whole-digest rating can reach its headlines.
     * Registering the same id again replaces the earlier headlines. Headlines from sources
     * outside the configured allow-list are rejected, so digest feedback never trains them.
     */
    public void registerDigest(String digestId, double predictedScore, List<Headline> headlines, Instant now) {
        requireText(digestId, "digestId");
        requireUrgency(predictedScore, "predictedScore");
        if (headlines == null || headlines.isEmpty()) {
            throw new ValidationException("headlines", "A digest needs at least one headline");
        }
        List<DigestHeadline> rows = new ArrayList<>();
        for (Headline h : headlines) {
            requireText(h.title(), "headline");
            requireText(h.source(), "source");
            requireAllowedSource(h.source());
            rows.add(new DigestHeadline(h.title(), h.source(), SourceNames.normalizeContentType(h.contentType()),
                h.url()));
        }

        try {
            digestRepo.save(new Digest(digestId, predictedScore, rows, now));
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to register digest " + digestId, e);
        }
        log.info("Registered digest {} with {} headlines", digestId, rows.size());
    }

    /**
     * Apply a whole-digest rating to every headline of the digest with the digest weight.
     */
    public IngestResult ingestDigestFeedback(String digestId, double rating, String comment, Instant now) {
        try {
            requireText(digestId, "digestId");
            requireUrgency(rating, "rating");

            return db.executeInTransaction(conn -> {
                if (feedbackRepo.exists(FeedbackRecord.FeedbackKind.DIGEST, digestId)) {
                    throw new DuplicateFeedbackException(digestId);
                }
                Digest digest = digestRepo.find(digestId)
                    .orElseThrow(() -> new ValidationException("digestId", "Unknown digest " + digestId));

                FeedbackType type = FeedbackType.forDigest(digest.predictedScore(), rating);
                DigestFeedback record = new DigestFeedback(digestId, rating, comment, now);
                insertRecord(record, type);
                recordInsights(record, rating, now);

                double m = settings.getDigestWeightMultiplier();
                for (DigestHeadline h : digest.headlines()) {
                    learn(h.headline(), h.source(), h.contentType(), rating, digest.predictedScore(), m, now);
                }
                log.info("Applied digest feedback {} (rating {}, {}) to {} headlines",
                    digestId, rating, type, digest.headlines().size());
                return IngestResult.applied(digestId, digest.headlines().size(), type);
            });
        } catch (ValidationException e) {
            log.info("Rejected digest feedback {}: {}", digestId, e.getMessage());
            return IngestResult.invalid(digestId, e.getMessage());
        } catch (DuplicateFeedbackException e) {
            log.info("Ignoring duplicate digest feedback {}", digestId);
            return IngestResult.duplicate(digestId);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to ingest digest feedback " + digestId, e);
        }
    }

    // ==================== Articles ====================

    /**
     * Apply a single-article rating (article weight) or an irrelevant mark
     * (irrelevant weight, trained toward the irrelevant target).
     */
    public IngestResult ingestArticleFeedback(ArticleFeedback feedback, Instant now) {
        String key = feedback == null ? null : feedback.articleId();
        try {
            ArticleFeedback fb = validate(feedback, now);

            return db.executeInTransaction(conn -> {
                if (feedbackRepo.exists(FeedbackRecord.FeedbackKind.ARTICLE, fb.articleId())) {
                    throw new DuplicateFeedbackException(fb.articleId());
                }
                return fb.irrelevant() ? applyIrrelevant(fb, now) : applyRating(fb, now);
            });
        } catch (ValidationException e) {
            log.info("Rejected article feedback {}: {}", key, e.getMessage());
            return IngestResult.invalid(key, e.getMessage());
        } catch (DuplicateFeedbackException e) {
            log.info("Ignoring duplicate article feedback {}", key);
            return IngestResult.duplicate(key);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to ingest article feedback " + key, e);
        }
    }

    private IngestResult applyRating(ArticleFeedback fb, Instant now) throws SQLException {
        double rating = fb.rating();
        Optional<PredictionRecord> prediction = predictions.resolve(
            fb.predictionId(), fb.headline(), SourceNames.normalize(fb.source()), fb.createdAt());

        Double predicted = fb.aiScore();
        if (predicted == null && prediction.isPresent()) {
            predicted = prediction.get().predictedScore();
        }

        FeedbackType type = FeedbackType.forArticle(rating, predicted);
        insertRecord(fb, type);
        recordInsights(fb, rating, now);
        learn(fb.headline(), fb.source(), fb.contentType(), rating, predicted,
            settings.getArticleWeightMultiplier(), now);

        if (prediction.isPresent()) {
            predictions.attachOutcome(prediction.get(), rating, now);
        }

        log.info("Applied article feedback {} (rating {}, {})", fb.articleId(), rating, type);
        return IngestResult.applied(fb.articleId(), 1, type);
    }

    private IngestResult applyIrrelevant(ArticleFeedback fb, Instant now) throws SQLException {
        insertRecord(fb, FeedbackType.IRRELEVANT);

        double target = settings.getIrrelevantTargetUrgency();
        double m = settings.getIrrelevantWeightMultiplier();

        // The pattern that currently scores this headline is pushed down as well as its own signature
        HeadlineSignature own = patterns.signatureOf(fb.headline());
        Optional<PatternMatch> matched = patterns.match(fb.headline());
        patterns.upsert(own, target, m, now);
        if (matched.isPresent() && !matched.get().pattern().signature().equals(own.signature())) {
            Pattern p = matched.get().pattern();
            patterns.upsert(new HeadlineSignature(p.signature(), p.coarseKey()), target, m, now);
        }
        keywords.updateAll(fb.headline(), target, m, now);

        log.info("Applied irrelevant mark {} for '{}'", fb.articleId(), fb.headline());
        return IngestResult.applied(fb.articleId(), 1, FeedbackType.IRRELEVANT);
    }

    private ArticleFeedback validate(ArticleFeedback fb, Instant now) {
        if (fb == null) {
            throw new ValidationException("Feedback is required");
        }
        requireText(fb.articleId(), "articleId");
        requireText(fb.headline(), "headline");
        requireText(fb.source(), "source");
        if (fb.rating() != null && fb.irrelevant()) {
            throw new ValidationException("rating", "Give either a rating or an irrelevant mark, not both");
        }
        if (fb.rating() == null && !fb.irrelevant()) {
            throw new ValidationException("rating", "A rating or an irrelevant mark is required");
        }
        if (fb.rating() != null) {
            requireUrgency(fb.rating(), "rating");
        }
        if (fb.aiScore() != null) {
            requireUrgency(fb.aiScore(), "aiScore");
        }
        requireAllowedSource(fb.source());
        return new ArticleFeedback(fb.articleId(), fb.headline(), fb.source(),
            SourceNames.normalizeContentType(fb.contentType()), fb.rating(), fb.irrelevant(), fb.comment(),
            fb.aiScore(), fb.predictionId(), fb.createdAt() != null ? fb.createdAt() : now);
    }

    // ==================== Error reports ====================

    public void reportFalsePositive(String headline, String reason, Double predictedUrgency, Instant now) {
        requireText(headline, "headline");
        if (predictedUrgency != null) {
            requireUrgency(predictedUrgency, "predictedUrgency");
        }
        try {
            errorReportRepo.saveFalsePositive(new FalsePositive(headline, reason, predictedUrgency, now));
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to record false positive", e);
        }
        log.info("False positive reported: {}", headline);
    }

    public void reportMissedSignal(String description, String details, Double actualUrgency, Instant now) {
        requireText(description, "description");
        if (actualUrgency != null) {
            requireUrgency(actualUrgency, "actualUrgency");
        }
        try {
            errorReportRepo.saveMissedSignal(new MissedSignal(description, details, actualUrgency, now));
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to record missed signal", e);
        }
        log.info("Missed signal reported: {}", description);
    }

    public FeedbackSummary feedbackSummary(Instant now) {
        try {
            AccuracyReport accuracy = predictions.accuracyReport(null);
            int total = feedbackRepo.count();
            Map<FeedbackType, Integer> recent = feedbackRepo.countByTypeSince(now.minus(RECENT));
            return new FeedbackSummary(
                accuracy.accuracy(),
                accuracy.realizedCount(),
                total,
                recent,
                errorReportRepo.countFalsePositives(),
                errorReportRepo.countMissedSignals(),
                insightRepo.count(),
                total > 0 ? LearningStatus.ACTIVE : LearningStatus.WAITING_FOR_FEEDBACK
            );
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to build feedback summary", e);
        }
    }

    // ==================== Internals ====================

    /**
     * Pattern and keyword updates always; the source update only when a predicted score is known.
     */
    private void learn(String headline, String source, String contentType, double rating, Double predicted,
                       double m, Instant now) {
        patterns.upsert(patterns.signatureOf(headline), rating, m, now);
        keywords.updateAll(headline, rating, m, now);
        if (predicted != null) {
            sources.recordOutcome(source, contentType, predicted, rating, m, now);
        }
    }

    private void recordInsights(FeedbackRecord record, double urgency, Instant now) throws SQLException {
        String comment = record.comment();
        for (String phrase : insights.extract(comment)) {
            insightRepo.save(new UserInsight(record.kind(), record.feedbackKey(), phrase,
                CommentInsightExtractor.context(comment), urgency, urgency / 10.0, now));
            log.debug("Recorded insight '{}' from {} {}", phrase, record.kind(), record.feedbackKey());
        }
    }

    private void insertRecord(FeedbackRecord record, FeedbackType type) throws SQLException {
        try {
            feedbackRepo.insert(record, type);
        } catch (SQLException e) {
            if ((e.getErrorCode() & 0xFF) == SQLITE_CONSTRAINT) {
                throw new DuplicateFeedbackException(record.feedbackKey());
            }
            throw e;
        }
    }

    private void requireAllowedSource(String source) {
        if (!sources.isAllowed(source)) {
            throw new ValidationException("source", "Unknown source " + source);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "Missing " + field);
        }
    }

    private static void requireUrgency(double value, String field) {
        if (!Scores.isUrgency(value)) {
            throw new ValidationException(field, field + " must be within 0-10, got " + value);
        }
    }
}
