package com.canary.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Signal weights, trust damping and economic adjustment used when combining a prediction.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PredictionSettings {

    private double patternWeight = 0.6;
    private double keywordWeight = 0.3;
    private double neutralScore = 5.0;              // fallback when nothing else is known
    private double trustFloor = 0.5;
    private double trustCeiling = 1.2;
    private double vixWeight = 1.0;
    private double goldWeight = 0.5;
    private double usdIndexWeight = 0.3;
    private double btcWeight = 0.3;
    private double maxEconomicAdjustment = 1.5;

    public double getPatternWeight() {
        return patternWeight;
    }

    public void setPatternWeight(double patternWeight) {
        this.patternWeight = patternWeight;
    }

    public double getKeywordWeight() {
        return keywordWeight;
    }

    public void setKeywordWeight(double keywordWeight) {
        this.keywordWeight = keywordWeight;
    }

    public double getNeutralScore() {
        return neutralScore;
    }

    public void setNeutralScore(double neutralScore) {
        this.neutralScore = neutralScore;
    }

    public double getTrustFloor() {
        return trustFloor;
    }

    public void setTrustFloor(double trustFloor) {
        this.trustFloor = trustFloor;
    }

    public double getTrustCeiling() {
        return trustCeiling;
    }

    public void setTrustCeiling(double trustCeiling) {
        this.trustCeiling = trustCeiling;
    }

    public double getVixWeight() {
        return vixWeight;
    }

    public void setVixWeight(double vixWeight) {
        this.vixWeight = vixWeight;
    }

    public double getGoldWeight() {
        return goldWeight;
    }

    public void setGoldWeight(double goldWeight) {
        this.goldWeight = goldWeight;
    }

    public double getUsdIndexWeight() {
        return usdIndexWeight;
    }

    public void setUsdIndexWeight(double usdIndexWeight) {
        this.usdIndexWeight = usdIndexWeight;
    }

    public double getBtcWeight() {
        return btcWeight;
    }

    public void setBtcWeight(double btcWeight) {
        this.btcWeight = btcWeight;
    }

    public double getMaxEconomicAdjustment() {
        return maxEconomicAdjustment;
    }

    public void setMaxEconomicAdjustment(double maxEconomicAdjustment) {
        this.maxEconomicAdjustment = maxEconomicAdjustment;
    }
}
