package com.canary.intel.report;

import com.canary.core.error.StorageUnavailableException;
import com.canary.intel.learning.KeywordWeightTracker;
import com.canary.intel.learning.PatternStore;
import com.canary.intel.learning.SourceReliabilityTracker;
import com.canary.intel.store.FeedbackRepo;
import com.canary.intel.store.QuarantineRepo;
import com.canary.intel.tracking.AccuracyReport;
import com.canary.intel.tracking.PredictionTracker;

import java.sql.SQLException;
import java.util.List;

/**
 * Builds {@link IntelligenceReport}s. Read-only.
 */
public class IntelligenceReporter {

    private final PatternStore patterns;
    private final KeywordWeightTracker keywords;
    private final SourceReliabilityTracker sources;
    private final PredictionTracker predictions;
    private final FeedbackRepo feedbackRepo;
    private final QuarantineRepo quarantineRepo;
    private final int topKeywordLimit;

    public IntelligenceReporter(PatternStore patterns, KeywordWeightTracker keywords, SourceReliabilityTracker sources,
                                PredictionTracker predictions, FeedbackRepo feedbackRepo,
                                QuarantineRepo quarantineRepo, int topKeywordLimit) {
        this.patterns = patterns;
        this.keywords = keywords;
        this.sources = sources;
        this.predictions = predictions;
        this.feedbackRepo = feedbackRepo;
        this.quarantineRepo = quarantineRepo;
        this.topKeywordLimit = topKeywordLimit;
    }

    public IntelligenceReport build() {
        List<IntelligenceReport.TopKeyword> top = keywords.topKeywords(topKeywordLimit).stream()
            .map(k -> new IntelligenceReport.TopKeyword(k.term(), k.weight(), k.sampleCount()))
            .toList();

        List<IntelligenceReport.SourceScore> scores = sources.storedScores().stream()
            .map(s -> new IntelligenceReport.SourceScore(s.source(), s.contentType(), s.reliability(), s.sampleCount()))
            .toList();

        AccuracyReport accuracy = predictions.accuracyReport(null);

        try {
            return new IntelligenceReport(
                patterns.count(),
                keywords.count(),
                feedbackRepo.count(),
                predictions.count(),
                top,
                scores,
                new IntelligenceReport.AccuracySummary(accuracy.realizedCount(), accuracy.meanAbsoluteError(),
                    accuracy.accuracy()),
                quarantineRepo.count()
            );
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to build intelligence report", e);
        }
    }
}
