package com.canary.intel.learning;

import com.canary.core.config.KeywordSettings;
import com.canary.core.error.CorruptRecordException;
import com.canary.core.error.StorageUnavailableException;
import com.canary.core.model.Scores;
import com.canary.intel.model.KeywordWeight;
import com.canary.intel.store.KeywordRepo;
import com.canary.intel.store.QuarantineRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-term urgency weights learned as an exponential moving average.
 * A step with weight multiplier m moves the weight by {@code min(1, rate*m)} of the
 * distance to the observation; unseen terms start from the prior weight.
 */
public class KeywordWeightTracker {

    private static final Logger log = LoggerFactory.getLogger(KeywordWeightTracker.class);

    private final KeywordRepo repo;
    private final QuarantineRepo quarantine;
    private final KeywordSettings settings;
    private final KeywordExtractor extractor;

    public KeywordWeightTracker(KeywordRepo repo, QuarantineRepo quarantine, KeywordSettings settings,
                                KeywordExtractor extractor) {
        this.repo = repo;
        this.quarantine = quarantine;
        this.settings = settings;
        this.extractor = extractor;
    }

    public List<String> extractKeywords(String headline) {
        return extractor.extract(headline);
    }

    public KeywordWeight update(String term, double observedUrgency, double weightMultiplier, Instant now) {
        double observed = Scores.clampUrgency(observedUrgency);
        try {
            Optional<KeywordWeight> existing = findForUpdate(term, now);
            double current = existing.map(KeywordWeight::weight).orElse(settings.getPriorWeight());
            double samples = existing.map(KeywordWeight::sampleCount).orElse(0.0);

            double step = Math.min(1.0, settings.getLearningRate() * weightMultiplier);
            double next = Scores.clampUrgency(current + step * (observed - current));

            KeywordWeight updated = new KeywordWeight(term, next, samples + weightMultiplier, now);
            repo.save(updated);
            return updated;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to update keyword " + term, e);
        }
    }

    /**
     * Update every keyword of the headline.
     *
     * @return the keywords updated
     */
    public List<String> updateAll(String headline, double observedUrgency, double weightMultiplier, Instant now) {
        List<String> terms = extractKeywords(headline);
        for (String term : terms) {
            update(term, observedUrgency, weightMultiplier, now);
        }
        log.debug("Updated {} keywords toward {} (m={})", terms.size(), observedUrgency, weightMultiplier);
        return terms;
    }

    public KeywordScore score(String headline) {
        List<String> terms = extractKeywords(headline);
        if (terms.isEmpty()) {
            return KeywordScore.none();
        }
        try {
            Map<String, KeywordWeight> known = repo.findAll(terms);
            double weighted = 0.0;
            double samples = 0.0;
            List<String> matched = new ArrayList<>();
            for (String term : terms) {
                KeywordWeight w = known.get(term);
                if (w != null && w.sampleCount() > 0) {
                    weighted += w.weight() * w.sampleCount();
                    samples += w.sampleCount();
                    matched.add(term);
                }
            }
            if (samples <= 0) {
                return KeywordScore.none();
            }
            double confidence = samples / (samples + settings.getConfidenceHalfSaturation());
            return new KeywordScore(Scores.clampUrgency(weighted / samples), confidence, samples, matched);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to score keywords", e);
        }
    }

    public List<KeywordWeight> topKeywords(int limit) {
        try {
            return repo.findTop(limit);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to read top keywords", e);
        }
    }

    public int count() {
        try {
            return repo.count();
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to count keywords", e);
        }
    }

    private Optional<KeywordWeight> findForUpdate(String term, Instant now) throws SQLException {
        try {
            return repo.find(term);
        } catch (CorruptRecordException e) {
            quarantine.quarantine(e, now);
            return Optional.empty();
        }
    }
}
