package com.stockinsight.analysis.indicator;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Headline figures of the price series. {@code changePercent} and {@code volatilityPercent}
 * are null when the series is too short to compute them.
 */
public record PriceSummary(
    @JsonProperty("currentPrice") double currentPrice,
    @JsonProperty("changePercent") Double changePercent,
    @JsonProperty("volumeRatio") Double volumeRatio,
    @JsonProperty("volatilityPercent") Double volatilityPercent
) {}
