package com.canary.intel.tracking;

import com.canary.core.error.StorageUnavailableException;
import com.canary.core.model.Scores;
import com.canary.core.model.UrgencyLevel;
import com.canary.intel.model.PredictionRecord;
import com.canary.intel.store.PredictionRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Records predictions and the user-reported urgency they are later matched with.
 */
public class PredictionTracker {

    private static final Logger log = LoggerFactory.getLogger(PredictionTracker.class);

    private final PredictionRepo repo;
    private final Duration matchWindow;

    public PredictionTracker(PredictionRepo repo, Duration matchWindow) {
        this.repo = repo;
        this.matchWindow = matchWindow;
    }

    public static String newPredictionId(Instant now) {
        return Ulid.generate(now.toEpochMilli());
    }

    public void recordPrediction(PredictionRecord record) {
        try {
            repo.save(record);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to record prediction " + record.predictionId(), e);
        }
    }

    public Optional<PredictionRecord> find(String predictionId) {
        try {
            return repo.find(predictionId);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to read prediction " + predictionId, e);
        }
    }

    /**
     * Find the prediction a piece of feedback refers to: by id when given, else the most
     * recent unrealized prediction for the same headline and source within the match
     * window before {@code at}.
     */
    public Optional<PredictionRecord> resolve(String predictionId, String headline, String source, Instant at) {
        try {
            if (predictionId != null && !predictionId.isBlank()) {
                return repo.find(predictionId);
            }
            if (headline == null || source == null) {
                return Optional.empty();
            }
            return repo.findLatestUnrealized(headline, source, at.minus(matchWindow), at);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to match prediction for '" + headline + "'", e);
        }
    }

    /**
     * Attach the realized score to a prediction.
     *
     * @return false if the prediction was already realized
     */
    public boolean attachOutcome(PredictionRecord prediction, double realizedScore, Instant at) {
        if (prediction.isRealized()) {
            log.debug("Prediction {} already realized, keeping first outcome", prediction.predictionId());
            return false;
        }
        double realized = Scores.clampUrgency(realizedScore);
        double error = Math.abs(prediction.predictedScore() - realized);
        try {
            repo.attachOutcome(prediction.predictionId(), realized, error, at);
            return true;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to attach outcome to " + prediction.predictionId(), e);
        }
    }

    /**
     * Accuracy of predictions made since the given time; all time when null.
     */
    public AccuracyReport accuracyReport(Instant since) {
        List<PredictionRecord> realized;
        try {
            realized = repo.findRealized(since);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to read realized predictions", e);
        }

        Map<UrgencyLevel, List<PredictionRecord>> byBand = new EnumMap<>(UrgencyLevel.class);
        Map<String, List<PredictionRecord>> bySource = new TreeMap<>();
        List<PredictionRecord> internal = new ArrayList<>();
        List<PredictionRecord> fallback = new ArrayList<>();

        for (PredictionRecord r : realized) {
            byBand.computeIfAbsent(UrgencyLevel.fromScore(r.predictedScore()), k -> new ArrayList<>()).add(r);
            bySource.computeIfAbsent(r.source(), k -> new ArrayList<>()).add(r);
            (r.fallbackUsed() ? fallback : internal).add(r);
        }

        Map<UrgencyLevel, BandCalibration> calibration = new EnumMap<>(UrgencyLevel.class);
        byBand.forEach((band, records) -> calibration.put(band, calibrate(records)));

        Map<String, ErrorStats> perSource = new TreeMap<>();
        bySource.forEach((source, records) -> perSource.put(source, errorStats(records)));

        return new AccuracyReport(
            since,
            realized.size(),
            errorStats(realized).meanAbsoluteError(),
            calibration,
            perSource,
            errorStats(internal),
            errorStats(fallback)
        );
    }

    public int count() {
        try {
            return repo.count();
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to count predictions", e);
        }
    }

    private static ErrorStats errorStats(List<PredictionRecord> records) {
        if (records.isEmpty()) {
            return ErrorStats.empty();
        }
        double sum = 0.0;
        for (PredictionRecord r : records) {
            sum += errorOf(r);
        }
        return new ErrorStats(records.size(), sum / records.size());
    }

    private static BandCalibration calibrate(List<PredictionRecord> records) {
        double predicted = 0.0;
        double realized = 0.0;
        double error = 0.0;
        for (PredictionRecord r : records) {
            predicted += r.predictedScore();
            realized += r.realizedScore();
            error += errorOf(r);
        }
        int n = records.size();
        return new BandCalibration(n, predicted / n, realized / n, error / n);
    }

    private static double errorOf(PredictionRecord r) {
        return r.error() != null ? r.error() : Math.abs(r.predictedScore() - r.realizedScore());
    }
}
