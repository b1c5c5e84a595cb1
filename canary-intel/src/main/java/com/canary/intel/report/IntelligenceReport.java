package com.canary.intel.report;

import java.util.List;

/**
 * Snapshot of everything the engine has learned. Carries no generation time, so two
 * reports over unchanged data are equal.
 */
public record IntelligenceReport(
    int patternCount,
    int keywordCount,
    int feedbackCount,
    int predictionCount,
    List<TopKeyword> topKeywords,
    List<SourceScore> sourceScores,     // Stored values, before staleness decay
    AccuracySummary accuracy,           // All time
    int quarantinedRecords
) {
    public IntelligenceReport {
        topKeywords = List.copyOf(topKeywords);
        sourceScores = List.copyOf(sourceScores);
    }

    public record TopKeyword(String term, double weight, double sampleCount) {}

    public record SourceScore(String source, String contentType, double reliability, double sampleCount) {}

    public record AccuracySummary(int realizedPredictions, double meanAbsoluteError, double accuracy) {}
}
