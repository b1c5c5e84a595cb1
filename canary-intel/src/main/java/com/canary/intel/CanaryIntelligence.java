package com.canary.intel;

import com.canary.core.config.IntelConfig;
import com.canary.core.error.CorruptRecordException;
import com.canary.core.error.StorageUnavailableException;
import com.canary.core.model.EconomicSnapshot;
import com.canary.core.model.Headline;
import com.canary.intel.feedback.FeedbackIngester;
import com.canary.intel.feedback.FeedbackSummary;
import com.canary.intel.feedback.IngestResult;
import com.canary.intel.learning.KeywordExtractor;
import com.canary.intel.learning.KeywordWeightTracker;
import com.canary.intel.learning.PatternStore;
import com.canary.intel.learning.SourceReliabilityTracker;
import com.canary.intel.lock.JobLock;
import com.canary.intel.model.ArticleFeedback;
import com.canary.intel.predict.FallbackScoreProvider;
import com.canary.intel.predict.Prediction;
import com.canary.intel.predict.PredictionEngine;
import com.canary.intel.predict.PredictionRequest;
import com.canary.intel.report.IntelligenceReport;
import com.canary.intel.report.IntelligenceReporter;
import com.canary.intel.store.IntelDatabase;
import com.canary.intel.store.QuarantineRepo;
import com.canary.intel.store.RecordTable;
import com.canary.intel.store.dao.SqliteDigestRepo;
import com.canary.intel.store.dao.SqliteErrorReportRepo;
import com.canary.intel.store.dao.SqliteFeedbackRepo;
import com.canary.intel.store.dao.SqliteInsightRepo;
import com.canary.intel.store.dao.SqliteKeywordRepo;
import com.canary.intel.store.dao.SqlitePatternRepo;
import com.canary.intel.store.dao.SqlitePredictionRepo;
import com.canary.intel.store.dao.SqliteQuarantineRepo;
import com.canary.intel.store.dao.SqliteSourceRepo;
import com.canary.intel.tracking.AccuracyReport;
import com.canary.intel.tracking.PredictionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Entry point to the intelligence engine. Wires one instance of each tracker to one
 * database for the life of the process; nothing is shared through static state.
 *
 * <pre>
 * try (CanaryIntelligence intel = CanaryIntelligence.open(IntelConfig.load())) {
 *     Prediction p = intel.predict(Headline.of("BREAKING: Fed raises rates", "Reuters"));
 * }
 * </pre>
 */
public class CanaryIntelligence implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CanaryIntelligence.class);

    private final IntelConfig config;
    private final IntelDatabase db;
    private final Clock clock;

    private final PatternStore patterns;
    private final KeywordWeightTracker keywords;
    private final SourceReliabilityTracker sources;
    private final PredictionTracker predictions;
    private final PredictionEngine engine;
    private final FeedbackIngester ingester;
    private final IntelligenceReporter reporter;
    private final QuarantineRepo quarantine;
    private final List<RecordTable> checkedTables;

    public CanaryIntelligence(IntelConfig config, IntelDatabase db, Clock clock, FallbackScoreProvider fallbackProvider) {
        this.config = config;
        this.db = db;
        this.clock = clock;

        SqlitePatternRepo patternRepo = new SqlitePatternRepo(db);
        SqliteKeywordRepo keywordRepo = new SqliteKeywordRepo(db);
        SqliteSourceRepo sourceRepo = new SqliteSourceRepo(db);
        SqlitePredictionRepo predictionRepo = new SqlitePredictionRepo(db);
        SqliteFeedbackRepo feedbackRepo = new SqliteFeedbackRepo(db);
        this.quarantine = new SqliteQuarantineRepo(db);
        this.checkedTables = List.of(patternRepo, keywordRepo, sourceRepo, predictionRepo);

        this.patterns = new PatternStore(patternRepo, quarantine, config.getPatterns());
        this.keywords = new KeywordWeightTracker(keywordRepo, quarantine, config.getKeywords(),
            new KeywordExtractor(config.getKeywords(), config.getPatterns()));
        this.sources = new SourceReliabilityTracker(sourceRepo, quarantine, config.getSources());
        this.predictions = new PredictionTracker(predictionRepo,
            Duration.ofHours(config.getLearning().getOutcomeMatchWindowHours()));
        this.engine = new PredictionEngine(patterns, keywords, sources, predictions, config.getPrediction(),
            config.getPatterns(), config.getKeywords(), fallbackProvider);
        this.ingester = new FeedbackIngester(db, feedbackRepo, new SqliteDigestRepo(db),
            new SqliteErrorReportRepo(db), new SqliteInsightRepo(db), patterns, keywords, sources, predictions,
            config.getLearning());
        this.reporter = new IntelligenceReporter(patterns, keywords, sources, predictions, feedbackRepo, quarantine,
            config.getKeywords().getTopKeywords());
    }

    /**
     * Open the configured database (creating or migrating its schema) with the system clock
     * and no fallback model.
     */
    public static CanaryIntelligence open(IntelConfig config) {
        return new CanaryIntelligence(config, IntelDatabase.open(config.getStorage()), Clock.systemUTC(), null);
    }

    // ==================== Prediction ====================

    public Prediction predict(Headline headline) {
        return predict(PredictionRequest.of(headline));
    }

    public Prediction predict(Headline headline, EconomicSnapshot snapshot, Double externalScore) {
        return predict(new PredictionRequest(headline, snapshot, externalScore));
    }

    public Prediction predict(PredictionRequest request) {
        return engine.predict(request, now());
    }

    // ==================== Feedback ====================

    public void registerDigest(String digestId, double predictedScore, List<Headline> headlines) {
        ingester.registerDigest(digestId, predictedScore, headlines, now());
    }

    public IngestResult ingestDigestFeedback(String digestId, double rating, String comment) {
        return ingester.ingestDigestFeedback(digestId, rating, comment, now());
    }

    public IngestResult ingestArticleFeedback(ArticleFeedback feedback) {
        return ingester.ingestArticleFeedback(feedback, now());
    }

    public void reportFalsePositive(String headline, String reason, Double predictedUrgency) {
        ingester.reportFalsePositive(headline, reason, predictedUrgency, now());
    }

    public void reportMissedSignal(String description, String details, Double actualUrgency) {
        ingester.reportMissedSignal(description, details, actualUrgency, now());
    }

    public FeedbackSummary feedbackSummary() {
        return ingester.feedbackSummary(now());
    }

    // ==================== Reports ====================

    public IntelligenceReport intelligenceReport() {
        return reporter.build();
    }

    /**
     * Accuracy of predictions made within the window before now; all time when window is null.
     */
    public AccuracyReport accuracyReport(Duration window) {
        return predictions.accuracyReport(window == null ? null : now().minus(window));
    }

    // ==================== Maintenance ====================

    /**
     * Pattern decay, persisted source decay and the corrupt-record sweep, in one transaction.
     */
    public MaintenanceResult runMaintenance() {
        Instant now = now();
        try {
            MaintenanceResult result = db.executeInTransaction(conn -> {
                int quarantined = 0;
                for (RecordTable table : checkedTables) {
                    for (CorruptRecordException corrupt : table.scanCorrupt()) {
                        if (quarantine.quarantine(corrupt, now)) {
                            quarantined++;
                        }
                    }
                }
                int patternsDecayed = patterns.decay(now);
                int sourcesDecayed = sources.decay(now);
                return new MaintenanceResult(patternsDecayed, sourcesDecayed, quarantined);
            });
            log.info("Maintenance done: {} patterns decayed, {} sources decayed, {} records quarantined",
                result.patternsDecayed(), result.sourcesDecayed(), result.recordsQuarantined());
            return result;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Maintenance pass failed", e);
        }
    }

    public JobLock jobLock() {
        return new JobLock(config.getStorage().resolveLockDir(), clock);
    }

    // ==================== Components ====================

    public PatternStore patterns() {
        return patterns;
    }

    public KeywordWeightTracker keywords() {
        return keywords;
    }

    public SourceReliabilityTracker sources() {
        return sources;
    }

    public PredictionTracker predictions() {
        return predictions;
    }

    public IntelConfig config() {
        return config;
    }

    public Instant now() {
        return Instant.now(clock);
    }

    @Override
    public void close() {
        db.close();
    }
}
