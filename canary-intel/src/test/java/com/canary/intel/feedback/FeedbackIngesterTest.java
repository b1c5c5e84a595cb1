package com.canary.intel.feedback;

import com.canary.core.config.IntelConfig;
import com.canary.core.error.StorageUnavailableException;
import com.canary.core.error.ValidationException;
import com.canary.core.model.Headline;
import com.canary.intel.MutableClock;
import com.canary.intel.learning.KeywordExtractor;
import com.canary.intel.learning.KeywordWeightTracker;
import com.canary.intel.learning.PatternStore;
import com.canary.intel.learning.SourceReliabilityTracker;
import com.canary.intel.model.ArticleFeedback;
import com.canary.intel.model.FeedbackType;
import com.canary.intel.model.KeywordWeight;
import com.canary.intel.model.Pattern;
import com.canary.intel.model.PredictionRecord;
import com.canary.intel.model.UserInsight;
import com.canary.intel.store.IntelDatabase;
import com.canary.intel.store.KeywordRepo;
import com.canary.intel.store.dao.SqliteDigestRepo;
import com.canary.intel.store.dao.SqliteErrorReportRepo;
import com.canary.intel.store.dao.SqliteFeedbackRepo;
import com.canary.intel.store.dao.SqliteInsightRepo;
import com.canary.intel.store.dao.SqliteKeywordRepo;
import com.canary.intel.store.dao.SqlitePatternRepo;
import com.canary.intel.store.dao.SqlitePredictionRepo;
import com.canary.intel.store.dao.SqliteQuarantineRepo;
import com.canary.intel.store.dao.SqliteSourceRepo;
import com.canary.intel.tracking.PredictionTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FeedbackIngester: validation, at-most-once ingestion, atomicity and
 * the learning updates each channel applies.
 */
class FeedbackIngesterTest {

    private static final Instant T0 = MutableClock.T0;
    private static final String HEADLINE = "BREAKING: Federal Reserve raises rates";

    @TempDir
    Path tempDir;

    private IntelDatabase db;
    private IntelConfig config;
    private SqliteFeedbackRepo feedbackRepo;
    private SqliteInsightRepo insightRepo;
    private PatternStore patterns;
    private KeywordWeightTracker keywords;
    private SourceReliabilityTracker sources;
    private PredictionTracker predictions;
    private FeedbackIngester ingester;

    @BeforeEach
    void setUp() {
        db = new IntelDatabase(tempDir.resolve("feedback.db"), 1000);
        db.initialize();
        config = IntelConfig.defaults();
        ingester = wire(new SqliteKeywordRepo(db));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private FeedbackIngester wire(KeywordRepo keywordRepo) {
        SqliteQuarantineRepo quarantine = new SqliteQuarantineRepo(db);
        feedbackRepo = new SqliteFeedbackRepo(db);
        insightRepo = new SqliteInsightRepo(db);
        patterns = new PatternStore(new SqlitePatternRepo(db), quarantine, config.getPatterns());
        keywords = new KeywordWeightTracker(keywordRepo, quarantine, config.getKeywords(),
            new KeywordExtractor(config.getKeywords(), config.getPatterns()));
        sources = new SourceReliabilityTracker(new SqliteSourceRepo(db), quarantine, config.getSources());
        predictions = new PredictionTracker(new SqlitePredictionRepo(db), Duration.ofHours(168));
        return new FeedbackIngester(db, feedbackRepo, new SqliteDigestRepo(db), new SqliteErrorReportRepo(db),
            insightRepo, patterns, keywords, sources, predictions, config.getLearning());
    }

    private static ArticleFeedback.Builder article(String id) {
        return ArticleFeedback.builder()
            .articleId(id)
            .headline(HEADLINE)
            .source("Reuters");
    }

    private Pattern storedPattern() throws SQLException {
        return new SqlitePatternRepo(db).find(patterns.signatureOf(HEADLINE).signature()).orElseThrow();
    }

    @Nested
    @DisplayName("Article ratings")
    class ArticleTests {

        @Test
        @DisplayName("Rating updates pattern and keywords with article weight")
        void appliesRating() throws SQLException {
            // When
            IngestResult result = ingester.ingestArticleFeedback(article("a1").rating(8.0).build(), T0);

            // Then
            assertTrue(result.isApplied());
            assertEquals(FeedbackType.UNSCORED, result.feedbackType());
            Pattern p = storedPattern();
            assertEquals(2.0, p.sampleCount(), 1e-9);
            assertEquals(8.0, p.derivedUrgency(), 1e-9);
            assertEquals(5.0 + 0.2 * 3.0, keywords.topKeywords(1).get(0).weight(), 1e-9);
        }

        @Test
        @DisplayName("Without a predicted score the source is not updated")
        void noSourceUpdateWithoutPrediction() {
            ingester.ingestArticleFeedback(article("a1").rating(8.0).build(), T0);

            assertTrue(sources.storedScores().isEmpty());
        }

        @Test
        @DisplayName("AI score classifies the feedback and trains the source")
        void aiScore() {
            IngestResult result = ingester.ingestArticleFeedback(article("a1").rating(2.0).aiScore(8.0).build(), T0);

            assertEquals(FeedbackType.AI_OVERRATED, result.feedbackType());
            assertEquals(0.46, sources.storedScores().get(0).reliability(), 1e-9);
            assertEquals("reuters", sources.storedScores().get(0).source());
        }

        @Test
        @DisplayName("Duplicate article id is rejected and changes nothing")
        void duplicate() throws SQLException {
            // Given
            ingester.ingestArticleFeedback(article("a1").rating(8.0).build(), T0);

            // When
            IngestResult second = ingester.ingestArticleFeedback(article("a1").rating(1.0).build(), T0);

            // Then
            assertEquals(IngestStatus.REJECTED_DUPLICATE, second.status());
            assertEquals(2.0, storedPattern().sampleCount(), 1e-9);
            assertEquals(8.0, storedPattern().derivedUrgency(), 1e-9);
            assertEquals(1, feedbackRepo.count());
        }

        @Test
        @DisplayName("Irrelevant mark trains toward zero and leaves sources alone")
        void irrelevant() throws SQLException {
            IngestResult result = ingester.ingestArticleFeedback(
                article("a1").irrelevant(true).aiScore(9.0).build(), T0);

            assertEquals(FeedbackType.IRRELEVANT, result.feedbackType());
            assertEquals(0.0, storedPattern().derivedUrgency(), 1e-9);
            assertEquals(2.0, storedPattern().sampleCount(), 1e-9);
            assertTrue(sources.storedScores().isEmpty());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        private void assertInvalid(ArticleFeedback feedback) {
            IngestResult result = ingester.ingestArticleFeedback(feedback, T0);
            assertEquals(IngestStatus.REJECTED_INVALID, result.status());
            assertNotNull(result.reason());
        }

        @Test
        @DisplayName("Malformed feedback is rejected before anything is written")
        void rejectsMalformed() throws SQLException {
            assertInvalid(article("a1").build());
            assertInvalid(article("a2").rating(5.0).irrelevant(true).build());
            assertInvalid(article("a3").rating(11.0).build());
            assertInvalid(article("a4").rating(-0.5).build());
            assertInvalid(article("a5").rating(5.0).source(" ").build());
            assertInvalid(article("a6").rating(5.0).aiScore(12.0).build());
            assertInvalid(article("").rating(5.0).build());
            assertInvalid(null);

            assertEquals(0, feedbackRepo.count());
            assertEquals(0, patterns.count());
        }

        @Test
        @DisplayName("Sources outside the configured allow-list are rejected")
        void allowList() {
            config.getSources().setKnownSources(List.of("npr.org"));
            FeedbackIngester restricted = wire(new SqliteKeywordRepo(db));

            assertRejectedBy(restricted, article("a1").rating(5.0).build());
            assertTrue(restricted.ingestArticleFeedback(article("a2").rating(5.0).source("https://www.npr.org/x").build(), T0)
                .isApplied());
        }

        @Test
        @DisplayName("Digest headlines from sources outside the allow-list are rejected")
        void digestAllowList() throws SQLException {
            config.getSources().setKnownSources(List.of("reuters"));
            FeedbackIngester restricted = wire(new SqliteKeywordRepo(db));

            ValidationException e = assertThrows(ValidationException.class,
                () -> restricted.registerDigest("d1", 6.0, List.of(
                    Headline.of(HEADLINE, "Reuters"),
                    Headline.of("Senate opens fraud investigation", "Tabloid Daily")
                ), T0));

            assertTrue(e.getMessage().contains("Tabloid Daily"));
            assertTrue(new SqliteDigestRepo(db).find("d1").isEmpty());
            assertEquals(IngestStatus.REJECTED_INVALID, restricted.ingestDigestFeedback("d1", 8.0, null, T0).status());
            assertTrue(sources.storedScores().isEmpty());
        }

        private void assertRejectedBy(FeedbackIngester target, ArticleFeedback feedback) {
            assertEquals(IngestStatus.REJECTED_INVALID, target.ingestArticleFeedback(feedback, T0).status());
        }
    }

    @Nested
    @DisplayName("Atomicity")
    class AtomicityTests {

        @Test
        @DisplayName("A failing keyword write rolls back the whole ingestion")
        void rollsBack() throws SQLException {
            // Given
            FeedbackIngester failing = wire(new SqliteKeywordRepo(db) {
                @Override
                public void save(KeywordWeight weight) throws SQLException {
                    throw new SQLException("disk I/O error");
                }
            });

            // When / Then
            assertThrows(StorageUnavailableException.class,
                () -> failing.ingestArticleFeedback(article("a1").rating(8.0).build(), T0));

            assertEquals(0, feedbackRepo.count());
            assertEquals(0, patterns.count());

            FeedbackIngester healthy = wire(new SqliteKeywordRepo(db));
            assertTrue(healthy.ingestArticleFeedback(article("a1").rating(8.0).build(), T0).isApplied());
        }
    }

    @Nested
    @DisplayName("Digests")
    class DigestTests {

        private void registerDigest() {
            ingester.registerDigest("d1", 6.0, List.of(
                Headline.of(HEADLINE, "Reuters"),
                Headline.of("Senate opens fraud investigation", "NPR")
            ), T0);
        }

        @Test
        @DisplayName("Digest rating reaches every headline with digest weight")
        void appliesToAllHeadlines() throws SQLException {
            registerDigest();

            IngestResult result = ingester.ingestDigestFeedback("d1", 8.0, "too calm", T0);

            assertTrue(result.isApplied());
            assertEquals(2, result.headlinesApplied());
            assertEquals(FeedbackType.INACCURATE, result.feedbackType());
            assertEquals(1.0, storedPattern().sampleCount(), 1e-9);
            assertEquals(2, patterns.count());
            assertEquals(2, sources.storedScores().size());
        }

        @Test
        @DisplayName("Same digest twice is a duplicate")
        void duplicateDigest() throws SQLException {
            registerDigest();
            ingester.ingestDigestFeedback("d1", 8.0, null, T0);

            IngestResult second = ingester.ingestDigestFeedback("d1", 2.0, null, T0);

            assertEquals(IngestStatus.REJECTED_DUPLICATE, second.status());
            assertEquals(1.0, storedPattern().sampleCount(), 1e-9);
        }

        @Test
        @DisplayName("Unknown digest or out-of-range rating is invalid")
        void invalidDigest() {
            registerDigest();

            assertEquals(IngestStatus.REJECTED_INVALID, ingester.ingestDigestFeedback("nope", 5.0, null, T0).status());
            assertEquals(IngestStatus.REJECTED_INVALID, ingester.ingestDigestFeedback("d1", 10.5, null, T0).status());
            assertEquals(0, patterns.count());
        }

        @Test
        @DisplayName("Accurate digest rating is classified as such")
        void accurate() {
            registerDigest();

            assertEquals(FeedbackType.ACCURATE, ingester.ingestDigestFeedback("d1", 6.5, null, T0).feedbackType());
        }
    }

    @Nested
    @DisplayName("Prediction outcomes")
    class OutcomeTests {

        private PredictionRecord recordPrediction(double score, Instant at) {
            PredictionRecord r = new PredictionRecord(PredictionTracker.newPredictionId(at), HEADLINE, "reuters",
                "news", "{}", score, false, at, null, null, null);
            predictions.recordPrediction(r);
            return r;
        }

        @Test
        @DisplayName("Rating realizes the prediction named by id")
        void byId() {
            PredictionRecord r = recordPrediction(6.0, T0.minusSeconds(600));

            IngestResult result = ingester.ingestArticleFeedback(
                article("a1").rating(8.0).predictionId(r.predictionId()).build(), T0);

            assertEquals(FeedbackType.REASONABLE_MATCH, result.feedbackType());
            PredictionRecord realized = predictions.find(r.predictionId()).orElseThrow();
            assertEquals(8.0, realized.realizedScore());
            assertEquals(2.0, realized.error(), 1e-9);
            assertEquals(1, sources.storedScores().size());
        }

        @Test
        @DisplayName("Rating realizes the latest prediction for the same headline and source")
        void byHeadline() {
            PredictionRecord r = recordPrediction(7.0, T0.minusSeconds(3600));

            ingester.ingestArticleFeedback(article("a1").rating(7.0).build(), T0);

            assertTrue(predictions.find(r.predictionId()).orElseThrow().isRealized());
            assertEquals(1, predictions.accuracyReport(null).realizedCount());
            assertEquals(1.0, predictions.accuracyReport(null).accuracy(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Comment insights")
    class InsightTests {

        @Test
        @DisplayName("Insight phrases in an article comment are kept with the corrected urgency")
        void articleComment() throws SQLException {
            ingester.ingestArticleFeedback(article("a1").rating(2.0)
                .comment("Honestly a FALSE   alarm, the model overreacted").build(), T0);

            List<UserInsight> stored = insightRepo.findAll();
            assertEquals(List.of("overreacted", "false alarm"), stored.stream().map(UserInsight::phrase).toList());
            UserInsight first = stored.get(0);
            assertEquals("a1", first.feedbackKey());
            assertEquals(2.0, first.correctedUrgency(), 1e-9);
            assertEquals(0.2, first.effectiveness(), 1e-9);
            assertEquals("Honestly a FALSE   alarm, the model overreacted", first.context());
        }

        @Test
        @DisplayName("Digest comments are read too and long comments are cut to 100 characters")
        void digestComment() throws SQLException {
            ingester.registerDigest("d1", 3.0, List.of(Headline.of(HEADLINE, "Reuters")), T0);
            String comment = "We should have noticed this one. " + "x".repeat(200);

            ingester.ingestDigestFeedback("d1", 9.0, comment, T0);

            UserInsight insight = insightRepo.findAll().get(0);
            assertEquals("should have noticed", insight.phrase());
            assertEquals(100, insight.context().length());
            assertEquals(9.0, insight.correctedUrgency(), 1e-9);
            assertEquals(1, ingester.feedbackSummary(T0).userInsights());
        }

        @Test
        @DisplayName("Comments without insight phrases record nothing")
        void plainComment() throws SQLException {
            ingester.ingestArticleFeedback(article("a1").rating(5.0).comment("fine").build(), T0);
            ingester.ingestArticleFeedback(article("a2").rating(5.0).build(), T0);

            assertEquals(0, insightRepo.count());
        }

        @Test
        @DisplayName("A duplicate ingestion records no second insight")
        void duplicateComment() throws SQLException {
            ingester.ingestArticleFeedback(article("a1").rating(9.0).comment("critical").build(), T0);
            ingester.ingestArticleFeedback(article("a1").rating(9.0).comment("critical").build(), T0);

            assertEquals(1, insightRepo.count());
        }
    }

    @Nested
    @DisplayName("Summary")
    class SummaryTests {

        @Test
        @DisplayName("Waits for feedback, then reports activity")
        void summary() {
            FeedbackSummary empty = ingester.feedbackSummary(T0);
            assertEquals(LearningStatus.WAITING_FOR_FEEDBACK, empty.status());
            assertEquals(0, empty.totalFeedback());

            ingester.ingestArticleFeedback(article("a1").rating(8.0).build(), T0);
            ingester.ingestArticleFeedback(article("a2").irrelevant(true).build(), T0);
            ingester.reportFalsePositive("Celebrity wedding", "not news", 7.0, T0);
            ingester.reportMissedSignal("Bank run in region", "no alert sent", 9.0, T0);

            FeedbackSummary summary = ingester.feedbackSummary(T0.plus(Duration.ofDays(1)));
            assertEquals(LearningStatus.ACTIVE, summary.status());
            assertEquals(2, summary.totalFeedback());
            assertEquals(1, summary.recent(FeedbackType.UNSCORED));
            assertEquals(1, summary.recent(FeedbackType.IRRELEVANT));
            assertEquals(0, summary.recent(FeedbackType.ACCURATE));
            assertEquals(1, summary.falsePositives());
            assertEquals(1, summary.missedSignals());
        }

        @Test
        @DisplayName("Feedback older than thirty days is not recent")
        void recentWindow() {
            ingester.ingestArticleFeedback(article("a1").rating(8.0).build(), T0);

            FeedbackSummary summary = ingester.feedbackSummary(T0.plus(Duration.ofDays(45)));

            assertEquals(1, summary.totalFeedback());
            assertEquals(0, summary.recent(FeedbackType.UNSCORED));
        }
    }
}
