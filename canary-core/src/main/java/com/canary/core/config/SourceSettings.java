package com.canary.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-(source, content type) reliability and its decay toward neutral.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SourceSettings {

    private double learningRate = 0.2;
    private double minSamples = 3.0;                // below this a source reads as neutral
    private double decayRatePerDay = 0.02;
    private int graceDays = 14;                     // staleness tolerated before decay starts
    private double floor = 0.1;
    private List<String> knownSources = new ArrayList<>(); // empty means any source is accepted

    public double getLearningRate() {
        return learningRate;
    }

    public void setLearningRate(double learningRate) {
        this.learningRate = learningRate;
    }

    public double getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(double minSamples) {
        this.minSamples = minSamples;
    }

    public double getDecayRatePerDay() {
        return decayRatePerDay;
    }

    public void setDecayRatePerDay(double decayRatePerDay) {
        this.decayRatePerDay = decayRatePerDay;
    }

    public int getGraceDays() {
        return graceDays;
    }

    public void setGraceDays(int graceDays) {
        this.graceDays = graceDays;
    }

    public double getFloor() {
        return floor;
    }

    public void setFloor(double floor) {
        this.floor = floor;
    }

    public List<String> getKnownSources() {
        return knownSources;
    }

    public void setKnownSources(List<String> knownSources) {
        this.knownSources = knownSources;
    }
}
