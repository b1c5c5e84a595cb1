package com.canary.intel.learning;

import com.canary.core.config.IntelConfig;
import com.canary.core.config.SourceSettings;
import com.canary.intel.MutableClock;
import com.canary.intel.model.SourceReliability;
import com.canary.intel.store.IntelDatabase;
import com.canary.intel.store.dao.SqliteQuarantineRepo;
import com.canary.intel.store.dao.SqliteSourceRepo;
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
 * Tests for source reliability learning and staleness decay.
 */
class SourceReliabilityTrackerTest {

    private static final Instant T0 = MutableClock.T0;

    @TempDir
    Path tempDir;

    private IntelDatabase db;
    private SqliteSourceRepo repo;
    private SourceSettings settings;
    private SourceReliabilityTracker tracker;

    @BeforeEach
    void setUp() {
        db = new IntelDatabase(tempDir.resolve("sources.db"), 1000);
        db.initialize();
        repo = new SqliteSourceRepo(db);
        settings = IntelConfig.defaults().getSources();
        tracker = new SourceReliabilityTracker(repo, new SqliteQuarantineRepo(db), settings);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private void trainPerfect(String source, int outcomes) {
        for (int i = 0; i < outcomes; i++) {
            tracker.recordOutcome(source, "news", 8.0, 8.0, 2.0, T0);
        }
    }

    @Nested
    @DisplayName("Learning")
    class LearningTests {

        @Test
        @DisplayName("Unseen source is neutral")
        void unseenIsNeutral() {
            assertEquals(0.5, tracker.reliability("nobody", "news", T0));
        }

        @Test
        @DisplayName("Accurate outcomes raise reliability")
        void accurateOutcomes() {
            SourceReliability first = tracker.recordOutcome("reuters", "news", 8.0, 8.0, 2.0, T0);
            SourceReliability second = tracker.recordOutcome("reuters", "news", 8.0, 8.0, 2.0, T0);

            assertEquals(0.7, first.reliability(), 1e-9);
            assertEquals(0.82, second.reliability(), 1e-9);
            assertEquals(4.0, second.sampleCount(), 1e-9);
            assertNull(second.decayedAt());
        }

        @Test
        @DisplayName("Too few samples reads as neutral")
        void minSamples() {
            trainPerfect("reuters", 1);
            assertEquals(0.5, tracker.reliability("reuters", "news", T0));

            trainPerfect("reuters", 1);
            assertEquals(0.82, tracker.reliability("reuters", "news", T0), 1e-9);
        }

        @Test
        @DisplayName("URL and display name forms share one record")
        void normalizesNames() {
            tracker.recordOutcome("https://www.npr.org/2024/05/01/story", "news", 5.0, 5.0, 2.0, T0);
            tracker.recordOutcome("NPR.org", "news", 5.0, 5.0, 2.0, T0);

            List<SourceReliability> stored = tracker.storedScores();
            assertEquals(1, stored.size());
            assertEquals("npr.org", stored.get(0).source());
        }

        @Test
        @DisplayName("Content types are tracked separately")
        void contentTypesSeparate() {
            trainPerfect("reuters", 2);

            tracker.recordOutcome("reuters", "economic", 8.0, 0.0, 2.0, T0);

            assertEquals(0.5, tracker.reliability("reuters", "economic", T0));
            assertEquals(0.82, tracker.reliability("reuters", "news", T0), 1e-9);
            assertEquals(2, tracker.storedScores().size());
        }

        @Test
        @DisplayName("Consistently wrong source bottoms out at the floor")
        void floor() {
            for (int i = 0; i < 4; i++) {
                tracker.recordOutcome("tabloid", "news", 10.0, 0.0, 2.0, T0);
            }

            assertEquals(settings.getFloor(), tracker.reliability("tabloid", "news", T0), 1e-9);
        }
    }

    @Nested
    @DisplayName("Decay")
    class DecayTests {

        @Test
        @DisplayName("No decay within the grace period")
        void gracePeriod() {
            trainPerfect("reuters", 2);

            assertEquals(0.82, tracker.reliability("reuters", "news", T0.plus(Duration.ofDays(14))), 1e-9);
        }

        @Test
        @DisplayName("Decays toward neutral after the grace period")
        void decaysTowardNeutral() {
            trainPerfect("reuters", 2);

            double expected = 0.5 + 0.32 * Math.exp(-0.02 * 10);
            assertEquals(expected, tracker.reliability("reuters", "news", T0.plus(Duration.ofDays(24))), 1e-9);
        }

        @Test
        @DisplayName("Persisted decay is never applied twice")
        void persistedDecay() throws SQLException {
            trainPerfect("reuters", 2);
            Instant day24 = T0.plus(Duration.ofDays(24));
            double expected = 0.5 + 0.32 * Math.exp(-0.02 * 10);

            assertEquals(1, tracker.decay(day24));
            SourceReliability stored = repo.find("reuters", "news").orElseThrow();
            assertEquals(expected, stored.reliability(), 1e-9);
            assertEquals(day24, stored.decayedAt());

            assertEquals(expected, tracker.reliability("reuters", "news", day24), 1e-9);
            assertEquals(0, tracker.decay(day24));

            Instant day34 = T0.plus(Duration.ofDays(34));
            assertEquals(0.5 + 0.32 * Math.exp(-0.02 * 20), tracker.reliability("reuters", "news", day34), 1e-9);
        }

        @Test
        @DisplayName("A new outcome after decay starts from the decayed value")
        void outcomeAfterDecay() {
            trainPerfect("reuters", 2);
            Instant day24 = T0.plus(Duration.ofDays(24));
            double decayed = 0.5 + 0.32 * Math.exp(-0.02 * 10);

            SourceReliability updated = tracker.recordOutcome("reuters", "news", 8.0, 8.0, 2.0, day24);

            assertEquals(decayed + 0.4 * (1.0 - decayed), updated.reliability(), 1e-9);
            assertEquals(day24, updated.lastUpdated());
        }
    }

    @Nested
    @DisplayName("Allow-list")
    class AllowListTests {

        @Test
        @DisplayName("Empty allow-list accepts every source")
        void emptyAcceptsAll() {
            assertTrue(tracker.isAllowed("anything"));
        }

        @Test
        @DisplayName("Configured allow-list matches normalized names")
        void configured() {
            settings.setKnownSources(List.of("Reuters", "https://www.npr.org"));
            SourceReliabilityTracker restricted = new SourceReliabilityTracker(repo, new SqliteQuarantineRepo(db), settings);

            assertTrue(restricted.isAllowed("reuters"));
            assertTrue(restricted.isAllowed("NPR.org"));
            assertFalse(restricted.isAllowed("random_blog"));
        }
    }
}
