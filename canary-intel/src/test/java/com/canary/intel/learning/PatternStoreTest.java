package com.canary.intel.learning;

import com.canary.core.config.IntelConfig;
import com.canary.core.config.PatternSettings;
import com.canary.intel.MutableClock;
import com.canary.intel.model.Pattern;
import com.canary.intel.store.IntelDatabase;
import com.canary.intel.store.dao.SqlitePatternRepo;
import com.canary.intel.store.dao.SqliteQuarantineRepo;
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
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PatternStore learning, matching and decay.
 */
class PatternStoreTest {

    private static final Instant T0 = MutableClock.T0;
    private static final String HEADLINE = "BREAKING: Federal Reserve raises rates";

    @TempDir
    Path tempDir;

    private IntelDatabase db;
    private SqlitePatternRepo repo;
    private PatternSettings settings;
    private PatternStore store;

    @BeforeEach
    void setUp() {
        db = new IntelDatabase(tempDir.resolve("patterns.db"), 1000);
        db.initialize();
        repo = new SqlitePatternRepo(db);
        settings = IntelConfig.defaults().getPatterns();
        store = new PatternStore(repo, new SqliteQuarantineRepo(db), settings);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Nested
    @DisplayName("Upsert")
    class UpsertTests {

        @Test
        @DisplayName("Unseen signature is created from the weighted first sample")
        void createsFromFirstSample() {
            Pattern p = store.upsert(store.signatureOf(HEADLINE), 8.0, 2.0, T0);

            assertEquals(16.0, p.sampleUrgencySum(), 1e-9);
            assertEquals(2.0, p.sampleCount(), 1e-9);
            assertEquals(8.0, p.derivedUrgency(), 1e-9);
            assertEquals(0.95 * 2 / 5, p.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Later samples add urgency times weight and weight")
        void accumulates() {
            HeadlineSignature sig = store.signatureOf(HEADLINE);
            store.upsert(sig, 8.0, 2.0, T0);
            Pattern p = store.upsert(sig, 4.0, 1.0, T0);

            assertEquals(20.0, p.sampleUrgencySum(), 1e-9);
            assertEquals(3.0, p.sampleCount(), 1e-9);
            assertEquals(20.0 / 3.0, p.derivedUrgency(), 1e-9);
        }

        @Test
        @DisplayName("Confidence increases with samples and stays under the ceiling")
        void confidenceMonotonic() {
            HeadlineSignature sig = store.signatureOf(HEADLINE);
            double previous = 0.0;
            for (int i = 0; i < 200; i++) {
                Pattern p = store.upsert(sig, 5.0, 1.0, T0);
                assertTrue(p.confidence() > previous);
                assertTrue(p.confidence() < settings.getConfidenceCeiling());
                previous = p.confidence();
            }
        }

        @Test
        @DisplayName("Observed urgency outside 0-10 is clamped")
        void clampsObservation() {
            Pattern p = store.upsert(store.signatureOf(HEADLINE), 14.0, 1.0, T0);

            assertEquals(10.0, p.derivedUrgency(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Matching")
    class MatchTests {

        @Test
        @DisplayName("Exact match needs the minimum samples")
        void exactNeedsMinSamples() {
            HeadlineSignature sig = store.signatureOf(HEADLINE);
            store.upsert(sig, 7.0, 1.0, T0);
            assertTrue(store.match(HEADLINE).isEmpty());

            store.upsert(sig, 7.0, 1.0, T0);
            Optional<PatternMatch> match = store.match(HEADLINE);

            assertTrue(match.isPresent());
            assertTrue(match.get().exact());
            assertEquals(7.0, match.get().derivedUrgency(), 1e-9);
        }

        @Test
        @DisplayName("Near match by coarse key carries a confidence penalty")
        void nearMatch() {
            Pattern trained = null;
            for (int i = 0; i < 3; i++) {
                trained = store.upsert(store.signatureOf(HEADLINE), 9.0, 2.0, T0);
            }
            String similar = "breaking news federal reserve holds rates steady and markets wait for more";
            assertNotEquals(store.signatureOf(HEADLINE).signature(), store.signatureOf(similar).signature());

            PatternMatch match = store.match(similar).orElseThrow();

            assertFalse(match.exact());
            assertEquals(trained.confidence() * settings.getNearMatchPenalty(), match.confidence(), 1e-9);
            assertEquals(9.0, match.derivedUrgency(), 1e-9);
        }

        @Test
        @DisplayName("A weakly trained exact signature does not hide a stronger near match")
        void weakExactYieldsToNearMatch() {
            for (int i = 0; i < 5; i++) {
                store.upsert(store.signatureOf(HEADLINE), 9.0, 2.0, T0);
            }
            String variant = "breaking news federal reserve holds rates steady and markets wait for more";
            store.upsert(store.signatureOf(variant), 1.0, 2.0, T0);

            PatternMatch match = store.match(variant).orElseThrow();

            assertFalse(match.exact());
            assertEquals(0.95 * 10 / 13 * settings.getNearMatchPenalty(), match.confidence(), 1e-9);
            assertEquals(9.0, match.derivedUrgency(), 1e-9);
        }

        @Test
        @DisplayName("Exact signature wins once it is at least as confident as the near match")
        void confidentExactWins() {
            for (int i = 0; i < 5; i++) {
                store.upsert(store.signatureOf(HEADLINE), 9.0, 2.0, T0);
            }
            String variant = "breaking news federal reserve holds rates steady and markets wait for more";
            for (int i = 0; i < 3; i++) {
                store.upsert(store.signatureOf(variant), 1.0, 2.0, T0);
            }

            PatternMatch match = store.match(variant).orElseThrow();

            assertTrue(match.exact());
            assertEquals(1.0, match.derivedUrgency(), 1e-9);
        }

        @Test
        @DisplayName("Headline without coarse key and without history matches nothing")
        void noMatch() {
            store.upsert(store.signatureOf(HEADLINE), 9.0, 2.0, T0);

            assertTrue(store.match("Local bakery wins regional award").isEmpty());
        }
    }

    @Nested
    @DisplayName("Decay")
    class DecayTests {

        @Test
        @DisplayName("Stale patterns lose confidence monotonically down to the floor")
        void decaysToFloor() throws SQLException {
            Pattern p = store.upsert(store.signatureOf(HEADLINE), 8.0, 2.0, T0);
            Instant later = T0.plus(Duration.ofDays(settings.getDecayWindowDays() + 1));

            assertEquals(1, store.decay(later));
            double once = repo.find(p.signature()).orElseThrow().confidence();
            assertEquals(p.confidence() * settings.getDecayMultiplier(), once, 1e-9);

            double previous = once;
            for (int i = 0; i < 50; i++) {
                store.decay(later);
                double current = repo.find(p.signature()).orElseThrow().confidence();
                assertTrue(current <= previous);
                assertTrue(current >= settings.getConfidenceFloor());
                previous = current;
            }
            assertEquals(settings.getConfidenceFloor(), previous, 1e-9);
            assertEquals(1, store.count());
        }

        @Test
        @DisplayName("Recently updated patterns are untouched")
        void freshPatternsKeepConfidence() throws SQLException {
            Pattern p = store.upsert(store.signatureOf(HEADLINE), 8.0, 2.0, T0);

            assertEquals(0, store.decay(T0.plus(Duration.ofDays(5))));
            assertEquals(p.confidence(), repo.find(p.signature()).orElseThrow().confidence(), 1e-12);
        }

        @Test
        @DisplayName("Confidence already below the floor is left alone")
        void belowFloorUnchanged() throws SQLException {
            repo.save(new Pattern("weak", "", 5.0, 1.0, 0.05, T0));

            store.decay(T0.plus(Duration.ofDays(365)));

            assertEquals(0.05, repo.find("weak").orElseThrow().confidence(), 1e-12);
        }
    }
}
