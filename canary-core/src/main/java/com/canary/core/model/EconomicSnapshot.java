package com.canary.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Normalized economic indicators captured alongside a headline.
 * Any field may be missing (null); missing fields contribute a neutral 0.0.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EconomicSnapshot(
    Double vix,             // Volatility index, normalized
    Double goldDelta,       // Gold price change, normalized
    Double usdIndexDelta,   // DXY change, normalized
    Double btcTrend         // Bitcoin trend, normalized
) {
    private static final EconomicSnapshot EMPTY = new EconomicSnapshot(null, null, null, null);

    public static EconomicSnapshot empty() {
        return EMPTY;
    }

    @JsonIgnore
    public double vixOrNeutral() {
        return neutral(vix);
    }

    @JsonIgnore
    public double goldDeltaOrNeutral() {
        return neutral(goldDelta);
    }

    @JsonIgnore
    public double usdIndexDeltaOrNeutral() {
        return neutral(usdIndexDelta);
    }

    @JsonIgnore
    public double btcTrendOrNeutral() {
        return neutral(btcTrend);
    }

    private static double neutral(Double value) {
        return value == null || value.isNaN() || value.isInfinite() ? 0.0 : value;
    }
}
