package com.canary.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-keyword urgency weights.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class KeywordSettings {

    private double learningRate = 0.1;
    private double priorWeight = 5.0;               // starting weight of an unseen term
    private double minConfidence = 0.5;
    private double confidenceHalfSaturation = 4.0;
    private int minTermLength = 3;
    private int topKeywords = 10;                   // shown in the intelligence report
    private List<String> stopwords = new ArrayList<>();

    public double getLearningRate() {
        return learningRate;
    }

    public void setLearningRate(double learningRate) {
        this.learningRate = learningRate;
    }

    public double getPriorWeight() {
        return priorWeight;
    }

    public void setPriorWeight(double priorWeight) {
        this.priorWeight = priorWeight;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public double getConfidenceHalfSaturation() {
        return confidenceHalfSaturation;
    }

    public void setConfidenceHalfSaturation(double confidenceHalfSaturation) {
        this.confidenceHalfSaturation = confidenceHalfSaturation;
    }

    public int getMinTermLength() {
        return minTermLength;
    }

    public void setMinTermLength(int minTermLength) {
        this.minTermLength = minTermLength;
    }

    public int getTopKeywords() {
        return topKeywords;
    }

    public void setTopKeywords(int topKeywords) {
        this.topKeywords = topKeywords;
    }

    public List<String> getStopwords() {
        return stopwords;
    }

    public void setStopwords(List<String> stopwords) {
        this.stopwords = stopwords;
    }
}
