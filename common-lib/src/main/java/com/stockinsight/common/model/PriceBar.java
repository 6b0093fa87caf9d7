package com.stockinsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

public record PriceBar(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("open") double open,
    @JsonProperty("high") double high,
    @JsonProperty("low") double low,
    @JsonProperty("close") double close,
    @JsonProperty("volume") long volume
) {
    public PriceBar {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static PriceBar of(Instant timestamp, double open, double high,
                              double low, double close, long volume) {
        return new PriceBar(timestamp, open, high, low, close, volume);
    }
}
