package com.canary.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural headline patterns: confidence curve, matching and decay.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PatternSettings {

    private double confidenceCeiling = 0.95;
    private double confidenceHalfSaturation = 3.0;  // samples at which confidence reaches half the ceiling
    private double minSamples = 2.0;
    private double matchThreshold = 0.6;            // confidence needed to act as primary signal
    private double nearMatchPenalty = 0.8;
    private int decayWindowDays = 30;
    private double decayMultiplier = 0.9;
    private double confidenceFloor = 0.1;
    private List<String> urgencyMarkers = new ArrayList<>();
    private List<String> watchTerms = new ArrayList<>();

    public double getConfidenceCeiling() {
        return confidenceCeiling;
    }

    public void setConfidenceCeiling(double confidenceCeiling) {
        this.confidenceCeiling = confidenceCeiling;
    }

    public double getConfidenceHalfSaturation() {
        return confidenceHalfSaturation;
    }

    public void setConfidenceHalfSaturation(double confidenceHalfSaturation) {
        this.confidenceHalfSaturation = confidenceHalfSaturation;
    }

    public double getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(double minSamples) {
        this.minSamples = minSamples;
    }

    public double getMatchThreshold() {
        return matchThreshold;
    }

    public void setMatchThreshold(double matchThreshold) {
        this.matchThreshold = matchThreshold;
    }

    public double getNearMatchPenalty() {
        return nearMatchPenalty;
    }

    public void setNearMatchPenalty(double nearMatchPenalty) {
        this.nearMatchPenalty = nearMatchPenalty;
    }

    public int getDecayWindowDays() {
        return decayWindowDays;
    }

    public void setDecayWindowDays(int decayWindowDays) {
        this.decayWindowDays = decayWindowDays;
    }

    public double getDecayMultiplier() {
        return decayMultiplier;
    }

    public void setDecayMultiplier(double decayMultiplier) {
        this.decayMultiplier = decayMultiplier;
    }

    public double getConfidenceFloor() {
        return confidenceFloor;
    }

    public void setConfidenceFloor(double confidenceFloor) {
        this.confidenceFloor = confidenceFloor;
    }

    public List<String> getUrgencyMarkers() {
        return urgencyMarkers;
    }

    public void setUrgencyMarkers(List<String> urgencyMarkers) {
        this.urgencyMarkers = urgencyMarkers;
    }

    public List<String> getWatchTerms() {
        return watchTerms;
    }

    public void setWatchTerms(List<String> watchTerms) {
        this.watchTerms = watchTerms;
    }
}
