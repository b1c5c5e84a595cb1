package com.canary.intel.predict;

import com.canary.core.config.KeywordSettings;
import com.canary.core.config.PatternSettings;
import com.canary.core.config.PredictionSettings;
import com.canary.core.error.StorageUnavailableException;
import com.canary.core.error.ValidationException;
import com.canary.core.model.EconomicSnapshot;
import com.canary.core.model.Headline;
import com.canary.core.model.Scores;
import com.canary.core.model.UrgencyLevel;
import com.canary.intel.learning.KeywordScore;
import com.canary.intel.learning.KeywordWeightTracker;
import com.canary.intel.learning.PatternMatch;
import com.canary.intel.learning.PatternStore;
import com.canary.intel.learning.SourceNames;
import com.canary.intel.learning.SourceReliabilityTracker;
import com.canary.intel.model.PredictionRecord;
import com.canary.intel.tracking.PredictionTracker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Combines learned signals into an urgency score.
 *
 * <pre>
 * internal = pw*pattern + kw*keywords            (a signal that did not fire has weight 0)
 * damped   = (pw+kw)*5 + trust*(internal - (pw+kw)*5)
 * score    = clamp(damped + (1-pw-kw)*fallback + economicAdjustment, 0, 10)
 * </pre>
 *
 * The engine only reads learned state. Storage failures never escape: the affected
 * signals are skipped and the score degrades toward the fallback.
 */
public class PredictionEngine {

    private static final Logger log = LoggerFactory.getLogger(PredictionEngine.class);

    private static final double MIDPOINT = (Scores.MIN_URGENCY + Scores.MAX_URGENCY) / 2.0;

    private final PatternStore patterns;
    private final KeywordWeightTracker keywords;
    private final SourceReliabilityTracker sources;
    private final PredictionTracker tracker;
    private final PredictionSettings settings;
    private final PatternSettings patternSettings;
    private final KeywordSettings keywordSettings;
    private final FallbackScoreProvider fallbackProvider;
    private final ObjectMapper mapper;

    public PredictionEngine(PatternStore patterns, KeywordWeightTracker keywords, SourceReliabilityTracker sources,
                            PredictionTracker tracker, PredictionSettings settings, PatternSettings patternSettings,
                            KeywordSettings keywordSettings, FallbackScoreProvider fallbackProvider) {
        this.patterns = patterns;
        this.keywords = keywords;
        this.sources = sources;
        this.tracker = tracker;
        this.settings = settings;
        this.patternSettings = patternSettings;
        this.keywordSettings = keywordSettings;
        this.fallbackProvider = fallbackProvider;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Prediction predict(PredictionRequest request, Instant now) {
        Headline headline = request.headline();
        if (headline == null || headline.title() == null || headline.title().isBlank()) {
            throw new ValidationException("headline", "Headline text is required");
        }
        String source = SourceNames.normalize(headline.source());
        String contentType = SourceNames.normalizeContentType(headline.contentType());
        List<String> notes = new ArrayList<>();
        boolean degraded = false;

        // 1. Pattern
        SignalContribution patternSignal = SignalContribution.absent("pattern");
        try {
            Optional<PatternMatch> match = patterns.match(headline.title());
            if (match.isPresent()) {
                PatternMatch m = match.get();
                boolean fired = m.confidence() >= patternSettings.getMatchThreshold();
                patternSignal = new SignalContribution("pattern", fired, m.derivedUrgency(), m.confidence(),
                    fired ? settings.getPatternWeight() : 0.0, m.pattern().signature());
                if (!m.exact()) {
                    notes.add("near pattern match");
                }
            }
        } catch (StorageUnavailableException e) {
            log.warn("Pattern lookup failed, skipping pattern signal: {}", e.getMessage());
            degraded = true;
        }

        // 2. Keywords
        SignalContribution keywordSignal = SignalContribution.absent("keywords");
        try {
            KeywordScore ks = keywords.score(headline.title());
            if (ks.hasEvidence()) {
                boolean fired = ks.confidence() >= keywordSettings.getMinConfidence();
                keywordSignal = new SignalContribution("keywords", fired, ks.score(), ks.confidence(),
                    fired ? settings.getKeywordWeight() : 0.0, String.join(",", ks.matchedTerms()));
            }
        } catch (StorageUnavailableException e) {
            log.warn("Keyword lookup failed, skipping keyword signal: {}", e.getMessage());
            degraded = true;
        }

        // 3. Source trust
        double reliability = Scores.NEUTRAL_RELIABILITY;
        try {
            reliability = sources.reliability(source, contentType, now);
        } catch (StorageUnavailableException e) {
            log.warn("Source lookup failed, assuming neutral reliability: {}", e.getMessage());
            degraded = true;
        }
        double trust = Scores.clamp(reliability / Scores.NEUTRAL_RELIABILITY,
            settings.getTrustFloor(), settings.getTrustCeiling());

        double internalWeight = patternSignal.weight() + keywordSignal.weight();
        double internal = patternSignal.weight() * patternSignal.value() + keywordSignal.weight() * keywordSignal.value();
        double damped = internalWeight * MIDPOINT + trust * (internal - internalWeight * MIDPOINT);

        // 4. Fallback
        boolean insufficient = !patternSignal.fired() && !keywordSignal.fired();
        FallbackSource fallbackSource = FallbackSource.NEUTRAL;
        double fallback = settings.getNeutralScore();
        if (request.externalScore() != null && Scores.isUrgency(request.externalScore())) {
            fallback = request.externalScore();
            fallbackSource = FallbackSource.EXTERNAL;
        } else if (insufficient && fallbackProvider != null) {
            OptionalDouble provided = askProvider(headline, request.economicSnapshot());
            if (provided.isPresent()) {
                fallback = Scores.clampUrgency(provided.getAsDouble());
                fallbackSource = FallbackSource.PROVIDER;
            }
        }
        if (insufficient) {
            notes.add("InsufficientDataFallback");
        }
        double fallbackWeight = 1.0 - internalWeight;

        // 5. Economy
        double economic = economicAdjustment(request.economicSnapshot());

        double score = Scores.clampUrgency(damped + fallbackWeight * fallback + economic);
        UrgencyLevel level = UrgencyLevel.fromScore(score);

        Explanation explanation = new Explanation(patternSignal, keywordSignal, reliability, trust, fallback,
            fallbackSource, fallbackWeight, insufficient, economic, degraded, notes);

        // 6. Record
        String predictionId = PredictionTracker.newPredictionId(now);
        boolean recorded = false;
        try {
            tracker.recordPrediction(new PredictionRecord(predictionId, headline.title(), source, contentType,
                snapshotJson(request), score, insufficient, now, null, null, null));
            recorded = true;
        } catch (StorageUnavailableException e) {
            log.warn("Could not record prediction {}: {}", predictionId, e.getMessage());
        }

        log.debug("Predicted {} ({}) for '{}'", score, level, headline.title());
        return new Prediction(predictionId, score, level, explanation, recorded);
    }

    /**
     * Bounded linear combination of the snapshot; missing fields contribute 0.
     */
    double economicAdjustment(EconomicSnapshot snapshot) {
        double raw = settings.getVixWeight() * snapshot.vixOrNeutral()
            + settings.getGoldWeight() * snapshot.goldDeltaOrNeutral()
            + settings.getUsdIndexWeight() * snapshot.usdIndexDeltaOrNeutral()
            + settings.getBtcWeight() * snapshot.btcTrendOrNeutral();
        double max = settings.getMaxEconomicAdjustment();
        return Scores.clamp(raw, -max, max);
    }

    private OptionalDouble askProvider(Headline headline, EconomicSnapshot snapshot) {
        try {
            OptionalDouble score = fallbackProvider.score(headline, snapshot);
            if (score == null || (score.isPresent() && Double.isNaN(score.getAsDouble()))) {
                return OptionalDouble.empty();
            }
            if (score.isPresent() && !Scores.isUrgency(score.getAsDouble())) {
                log.warn("Fallback provider returned out-of-range score {}, clamping", score.getAsDouble());
            }
            return score;
        } catch (RuntimeException e) {
            log.warn("Fallback provider failed, using neutral score: {}", e.getMessage());
            return OptionalDouble.empty();
        }
    }

    private String snapshotJson(PredictionRequest request) {
        try {
            return mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize prediction inputs: {}", e.getMessage());
            return null;
        }
    }
}
