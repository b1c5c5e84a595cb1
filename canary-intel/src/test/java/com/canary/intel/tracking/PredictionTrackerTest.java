package com.canary.intel.tracking;

import com.canary.core.model.UrgencyLevel;
import com.canary.intel.MutableClock;
import com.canary.intel.model.PredictionRecord;
import com.canary.intel.store.IntelDatabase;
import com.canary.intel.store.dao.SqlitePredictionRepo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for prediction matching and accuracy reporting.
 */
class PredictionTrackerTest {

    private static final Instant T0 = MutableClock.T0;

    @TempDir
    Path tempDir;

    private IntelDatabase db;
    private PredictionTracker tracker;

    @BeforeEach
    void setUp() {
        db = new IntelDatabase(tempDir.resolve("predictions.db"), 1000);
        db.initialize();
        tracker = new PredictionTracker(new SqlitePredictionRepo(db), Duration.ofHours(168));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private PredictionRecord record(String headline, String source, double score, boolean fallback, Instant at) {
        PredictionRecord r = new PredictionRecord(PredictionTracker.newPredictionId(at), headline, source, "news",
            "{}", score, fallback, at, null, null, null);
        tracker.recordPrediction(r);
        return r;
    }

    @Nested
    @DisplayName("Matching")
    class MatchingTests {

        @Test
        @DisplayName("Resolves by id when one is given")
        void byId() {
            PredictionRecord r = record("Fed raises rates", "reuters", 6.0, false, T0);

            Optional<PredictionRecord> found = tracker.resolve(r.predictionId(), null, null, T0.plusSeconds(60));

            assertEquals(r.predictionId(), found.orElseThrow().predictionId());
        }

        @Test
        @DisplayName("Resolves the latest unrealized prediction for headline and source")
        void byHeadline() {
            record("Fed raises rates", "reuters", 6.0, false, T0);
            PredictionRecord latest = record("Fed raises rates", "reuters", 7.0, false, T0.plusSeconds(3600));
            record("Fed raises rates", "npr.org", 2.0, false, T0.plusSeconds(7200));

            Optional<PredictionRecord> found = tracker.resolve(null, "Fed raises rates", "reuters", T0.plusSeconds(9000));

            assertEquals(latest.predictionId(), found.orElseThrow().predictionId());
        }

        @Test
        @DisplayName("Predictions outside the match window are not matched")
        void outsideWindow() {
            record("Fed raises rates", "reuters", 6.0, false, T0);

            assertTrue(tracker.resolve(null, "Fed raises rates", "reuters", T0.plus(Duration.ofDays(8))).isEmpty());
        }

        @Test
        @DisplayName("First outcome wins")
        void firstOutcomeKept() {
            PredictionRecord r = record("Fed raises rates", "reuters", 6.0, false, T0);

            assertTrue(tracker.attachOutcome(r, 9.0, T0.plusSeconds(60)));
            PredictionRecord realized = tracker.find(r.predictionId()).orElseThrow();
            assertFalse(tracker.attachOutcome(realized, 1.0, T0.plusSeconds(120)));

            PredictionRecord stored = tracker.find(r.predictionId()).orElseThrow();
            assertEquals(9.0, stored.realizedScore());
            assertEquals(3.0, stored.error(), 1e-9);
            assertTrue(tracker.resolve(null, "Fed raises rates", "reuters", T0.plusSeconds(180)).isEmpty());
        }
    }

    @Nested
    @DisplayName("Accuracy report")
    class AccuracyTests {

        @Test
        @DisplayName("Empty history reports zero accuracy")
        void empty() {
            AccuracyReport report = tracker.accuracyReport(null);

            assertEquals(0, report.realizedCount());
            assertEquals(0.0, report.accuracy());
            assertTrue(report.calibration().isEmpty());
        }

        @Test
        @DisplayName("Mean absolute error, bands, sources and fallback split")
        void aggregates() {
            tracker.attachOutcome(record("a", "reuters", 8.0, false, T0), 9.0, T0);
            tracker.attachOutcome(record("b", "reuters", 7.5, false, T0), 5.5, T0);
            tracker.attachOutcome(record("c", "npr.org", 5.0, true, T0), 2.0, T0);
            record("d", "npr.org", 1.0, false, T0);

            AccuracyReport report = tracker.accuracyReport(null);

            assertEquals(3, report.realizedCount());
            assertEquals(2.0, report.meanAbsoluteError(), 1e-9);
            assertEquals(0.8, report.accuracy(), 1e-9);

            BandCalibration high = report.calibration().get(UrgencyLevel.HIGH);
            assertEquals(2, high.count());
            assertEquals(7.75, high.meanPredicted(), 1e-9);
            assertEquals(7.25, high.meanRealized(), 1e-9);
            assertEquals(1.5, high.meanAbsoluteError(), 1e-9);
            assertEquals(1, report.calibration().get(UrgencyLevel.MEDIUM).count());
            assertNull(report.calibration().get(UrgencyLevel.LOW));

            assertEquals(1.5, report.perSource().get("reuters").meanAbsoluteError(), 1e-9);
            assertEquals(3.0, report.perSource().get("npr.org").meanAbsoluteError(), 1e-9);
            assertEquals(2, report.internal().count());
            assertEquals(1, report.fallback().count());
        }

        @Test
        @DisplayName("Window excludes older predictions")
        void window() {
            tracker.attachOutcome(record("old", "reuters", 8.0, false, T0), 0.0, T0);
            Instant later = T0.plus(Duration.ofDays(10));
            tracker.attachOutcome(record("new", "reuters", 8.0, false, later), 7.0, later);

            AccuracyReport report = tracker.accuracyReport(T0.plus(Duration.ofDays(5)));

            assertEquals(1, report.realizedCount());
            assertEquals(1.0, report.meanAbsoluteError(), 1e-9);
        }
    }
}
