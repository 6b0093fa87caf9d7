package com.stockinsight.analysis.indicator;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Bollinger bands at the latest bar. {@code position} is the close's location between
 * the lower (0) and upper (1) band, clamped to [0, 1]; a breach is reported by the flags.
 */
public record BollingerReading(
    @JsonProperty("upper") double upper,
    @JsonProperty("middle") double middle,
    @JsonProperty("lower") double lower,
    @JsonProperty("position") double position,
    @JsonProperty("aboveUpper") boolean aboveUpper,
    @JsonProperty("belowLower") boolean belowLower
) {}
