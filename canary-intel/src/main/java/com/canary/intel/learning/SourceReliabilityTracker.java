package com.canary.intel.learning;

import com.canary.core.config.SourceSettings;
import com.canary.core.error.CorruptRecordException;
import com.canary.core.error.StorageUnavailableException;
import com.canary.core.model.Scores;
import com.canary.intel.model.SourceReliability;
import com.canary.intel.store.QuarantineRepo;
import com.canary.intel.store.SourceRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Per (source, content type) reliability in [0, 1].
 *
 * <p>An outcome moves reliability toward {@code 1 - |predicted - realized| / 10}.
 * After a grace period without outcomes, reliability decays exponentially toward the
 * neutral 0.5 (never below the floor). Reads apply the decay without writing it;
 * {@link #decay(Instant)} persists it and records {@code decayed_at} so the same
 * stretch of time is never applied twice.</p>
 */
public class SourceReliabilityTracker {

    private static final Logger log = LoggerFactory.getLogger(SourceReliabilityTracker.class);

    private final SourceRepo repo;
    private final QuarantineRepo quarantine;
    private final SourceSettings settings;
    private final Set<String> knownSources;

    public SourceReliabilityTracker(SourceRepo repo, QuarantineRepo quarantine, SourceSettings settings) {
        this.repo = repo;
        this.quarantine = quarantine;
        this.settings = settings;
        this.knownSources = new HashSet<>();
        for (String s : settings.getKnownSources()) {
            knownSources.add(SourceNames.normalize(s));
        }
    }

    /**
     * True when no allow-list is configured or the source is on it.
     */
    public boolean isAllowed(String source) {
        return knownSources.isEmpty() || knownSources.contains(SourceNames.normalize(source));
    }

    public SourceReliability recordOutcome(String source, String contentType, double predicted, double realized,
                                           double weightMultiplier, Instant now) {
        String name = SourceNames.normalize(source);
        String type = SourceNames.normalizeContentType(contentType);
        double accuracy = 1.0 - Math.abs(Scores.clampUrgency(predicted) - Scores.clampUrgency(realized)) / 10.0;

        try {
            Optional<SourceReliability> existing = findForUpdate(name, type, now);
            double current = existing.map(r -> decayed(r, now)).orElse(Scores.NEUTRAL_RELIABILITY);
            double samples = existing.map(SourceReliability::sampleCount).orElse(0.0);

            double step = Math.min(1.0, settings.getLearningRate() * weightMultiplier);
            double next = Scores.clampUnit(current + step * (accuracy - current));

            SourceReliability updated = new SourceReliability(name, type, next, samples + weightMultiplier, now, null);
            repo.save(updated);
            log.debug("Source {}/{} reliability {} -> {} (accuracy {})", name, type, current, next, accuracy);
            return updated;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to update source " + name, e);
        }
    }

    /**
     * Current reliability with staleness decay applied. Sources with fewer than the
     * minimum samples, and unknown sources, are neutral (0.5).
     */
    public double reliability(String source, String contentType, Instant now) {
        String name = SourceNames.normalize(source);
        String type = SourceNames.normalizeContentType(contentType);
        try {
            Optional<SourceReliability> stored = repo.find(name, type);
            if (stored.isEmpty() || stored.get().sampleCount() < settings.getMinSamples()) {
                return Scores.NEUTRAL_RELIABILITY;
            }
            return decayed(stored.get(), now);
        } catch (CorruptRecordException e) {
            log.warn("Ignoring corrupt source reliability: {}", e.getMessage());
            return Scores.NEUTRAL_RELIABILITY;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to read reliability of " + name, e);
        }
    }

    /**
     * Persist staleness decay for every source.
     *
     * @return number of sources whose stored reliability changed
     */
    public int decay(Instant now) {
        int changed = 0;
        try {
            for (SourceReliability r : repo.findAll()) {
                double value = decayed(r, now);
                if (value != r.reliability()) {
                    repo.save(new SourceReliability(r.source(), r.contentType(), value, r.sampleCount(),
                        r.lastUpdated(), now));
                    changed++;
                }
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to decay source reliability", e);
        }
        if (changed > 0) {
            log.info("Decayed reliability of {} stale sources", changed);
        }
        return changed;
    }

    /**
     * Stored reliability values, undecayed, ordered by source.
     */
    public List<SourceReliability> storedScores() {
        try {
            return repo.findAll();
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to read source reliability", e);
        }
    }

    double decayed(SourceReliability r, Instant now) {
        Instant anchor = r.lastUpdated().plus(Duration.ofDays(settings.getGraceDays()));
        if (r.decayedAt() != null && r.decayedAt().isAfter(anchor)) {
            anchor = r.decayedAt();
        }
        double value = r.reliability();
        if (now.isAfter(anchor)) {
            double days = Duration.between(anchor, now).toMillis() / 86_400_000.0;
            double neutral = Scores.NEUTRAL_RELIABILITY;
            value = neutral + (value - neutral) * Math.exp(-settings.getDecayRatePerDay() * days);
        }
        return Scores.clamp(value, settings.getFloor(), 1.0);
    }

    private Optional<SourceReliability> findForUpdate(String source, String contentType, Instant now)
            throws SQLException {
        try {
            return repo.find(source, contentType);
        } catch (CorruptRecordException e) {
            quarantine.quarantine(e, now);
            return Optional.empty();
        }
    }
}
