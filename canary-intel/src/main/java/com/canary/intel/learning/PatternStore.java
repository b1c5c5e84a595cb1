package com.canary.intel.learning;

import com.canary.core.config.PatternSettings;
import com.canary.core.error.CorruptRecordException;
import com.canary.core.error.StorageUnavailableException;
import com.canary.core.model.Scores;
import com.canary.intel.model.Pattern;
import com.canary.intel.store.PatternRepo;
import com.canary.intel.store.QuarantineRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Learned headline patterns.
 *
 * <p>Each observation adds {@code urgency * m} to the pattern's urgency sum and
 * {@code m} to its sample count, so an article rating (m=2) counts as two digest
 * samples. Confidence is {@code ceiling * n / (n + halfSaturation)}: zero for no
 * samples, strictly increasing, never reaching the ceiling.</p>
 */
public class PatternStore {

    private static final Logger log = LoggerFactory.getLogger(PatternStore.class);

    private final PatternRepo repo;
    private final QuarantineRepo quarantine;
    private final PatternSettings settings;
    private final SignatureBuilder signatures;

    public PatternStore(PatternRepo repo, QuarantineRepo quarantine, PatternSettings settings) {
        this.repo = repo;
        this.quarantine = quarantine;
        this.settings = settings;
        this.signatures = new SignatureBuilder(settings);
    }

    public HeadlineSignature signatureOf(String headline) {
        return signatures.build(headline);
    }

    public double confidenceFor(double sampleCount) {
        if (sampleCount <= 0) {
            return 0.0;
        }
        return settings.getConfidenceCeiling() * sampleCount / (sampleCount + settings.getConfidenceHalfSaturation());
    }

    /**
     * Fold one observation into the pattern for the signature, creating it if unseen.
     * A corrupt stored row is quarantined and replaced.
     */
    public Pattern upsert(HeadlineSignature signature, double observedUrgency, double weightMultiplier, Instant now) {
        double urgency = Scores.clampUrgency(observedUrgency);
        try {
            Optional<Pattern> existing = findForUpdate(signature.signature(), now);

            double sum = urgency * weightMultiplier;
            double count = weightMultiplier;
            if (existing.isPresent()) {
                sum += existing.get().sampleUrgencySum();
                count += existing.get().sampleCount();
            }

            Pattern updated = new Pattern(signature.signature(), signature.coarseKey(), sum, count,
                confidenceFor(count), now);
            repo.save(updated);
            log.debug("Pattern {} now n={} urgency={}", updated.signature(), count, updated.derivedUrgency());
            return updated;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to update pattern " + signature.signature(), e);
        }
    }

    /**
     * Exact signature match or best near match sharing the coarse key (confidence scaled
     * by the near-match penalty), whichever is more confident. Both need the minimum
     * samples; on a tie the exact match wins.
     */
    public Optional<PatternMatch> match(String headline) {
        HeadlineSignature signature = signatures.build(headline);
        try {
            Optional<PatternMatch> exact = findForRead(signature.signature())
                .filter(p -> p.sampleCount() >= settings.getMinSamples())
                .map(p -> new PatternMatch(p, p.confidence(), true));
            if (!signature.hasCoarseKey()) {
                return exact;
            }

            List<Pattern> candidates = repo.findByCoarseKey(signature.coarseKey());
            Optional<PatternMatch> near = candidates.stream()
                .filter(p -> !p.signature().equals(signature.signature()))
                .filter(p -> p.sampleCount() >= settings.getMinSamples())
                .max(Comparator.comparingDouble(Pattern::confidence)
                    .thenComparingDouble(Pattern::sampleCount)
                    .thenComparing(Pattern::signature, Comparator.reverseOrder()))
                .map(p -> new PatternMatch(p, p.confidence() * settings.getNearMatchPenalty(), false));

            if (exact.isPresent() && (near.isEmpty() || exact.get().confidence() >= near.get().confidence())) {
                return exact;
            }
            return near;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to match patterns", e);
        }
    }

    /**
     * Reduce the confidence of patterns untouched for longer than the decay window.
     * Confidence never drops below the floor and patterns are never deleted.
     *
     * @return number of patterns whose confidence changed
     */
    public int decay(Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(settings.getDecayWindowDays()));
        int decayed = 0;
        try {
            for (Pattern p : repo.findStale(cutoff)) {
                if (p.confidence() <= settings.getConfidenceFloor()) {
                    continue;
                }
                double next = Math.max(settings.getConfidenceFloor(), p.confidence() * settings.getDecayMultiplier());
                if (next < p.confidence()) {
                    repo.updateConfidence(p.signature(), next);
                    decayed++;
                }
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to decay patterns", e);
        }
        if (decayed > 0) {
            log.info("Decayed confidence of {} stale patterns", decayed);
        }
        return decayed;
    }

    public int count() {
        try {
            return repo.count();
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to count patterns", e);
        }
    }

    private Optional<Pattern> findForUpdate(String signature, Instant now) throws SQLException {
        try {
            return repo.find(signature);
        } catch (CorruptRecordException e) {
            quarantine.quarantine(e, now);
            return Optional.empty();
        }
    }

    private Optional<Pattern> findForRead(String signature) throws SQLException {
        try {
            return repo.find(signature);
        } catch (CorruptRecordException e) {
            log.warn("Ignoring corrupt pattern: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
