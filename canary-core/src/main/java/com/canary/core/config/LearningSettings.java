package com.canary.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * How strongly each feedback channel trains the trackers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LearningSettings {

    private double articleWeightMultiplier = 2.0;   // per-article ratings count double
    private double digestWeightMultiplier = 1.0;
    private double irrelevantWeightMultiplier = 2.0;
    private double irrelevantTargetUrgency = 0.0;   // urgency an irrelevant mark trains toward
    private int outcomeMatchWindowHours = 168;      // best-effort prediction matching window
    private List<String> insightPhrases = new ArrayList<>();  // comment phrases kept as user insights

    public double getArticleWeightMultiplier() {
        return articleWeightMultiplier;
    }

    public void setArticleWeightMultiplier(double articleWeightMultiplier) {
        this.articleWeightMultiplier = articleWeightMultiplier;
    }

    public double getDigestWeightMultiplier() {
        return digestWeightMultiplier;
    }

    public void setDigestWeightMultiplier(double digestWeightMultiplier) {
        this.digestWeightMultiplier = digestWeightMultiplier;
    }

    public double getIrrelevantWeightMultiplier() {
        return irrelevantWeightMultiplier;
    }

    public void setIrrelevantWeightMultiplier(double irrelevantWeightMultiplier) {
        this.irrelevantWeightMultiplier = irrelevantWeightMultiplier;
    }

    public double getIrrelevantTargetUrgency() {
        return irrelevantTargetUrgency;
    }

    public void setIrrelevantTargetUrgency(double irrelevantTargetUrgency) {
        this.irrelevantTargetUrgency = irrelevantTargetUrgency;
    }

    public int getOutcomeMatchWindowHours() {
        return outcomeMatchWindowHours;
    }

    public void setOutcomeMatchWindowHours(int outcomeMatchWindowHours) {
        this.outcomeMatchWindowHours = outcomeMatchWindowHours;
    }

    public List<String> getInsightPhrases() {
        return insightPhrases;
    }

    public void setInsightPhrases(List<String> insightPhrases) {
        this.insightPhrases = insightPhrases;
    }
}
