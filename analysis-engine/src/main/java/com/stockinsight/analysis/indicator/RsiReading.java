package com.stockinsight.analysis.indicator;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RsiReading(
    @JsonProperty("value") double value,
    @JsonProperty("zone") RsiZone zone
) {
    public static RsiReading of(double value) {
        return new RsiReading(value, RsiZone.of(value));
    }
}
