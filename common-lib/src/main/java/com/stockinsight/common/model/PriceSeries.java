package com.stockinsight.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Daily bars for one symbol, oldest first.
 *
 * <p>The constructor rejects unordered input and duplicate timestamps, so every
 * consumer can index the series without re-checking. Instances are immutable.
 */
public final class PriceSeries {

    private final String symbol;
    private final List<PriceBar> bars;

    @JsonCreator
    public PriceSeries(@JsonProperty("symbol") String symbol,
                       @JsonProperty("bars") List<PriceBar> bars) {
        this.symbol = symbol;
        List<PriceBar> copy = bars == null ? List.of() : List.copyOf(bars);
        for (int i = 1; i < copy.size(); i++) {
            if (!copy.get(i).timestamp().isAfter(copy.get(i - 1).timestamp())) {
                throw new IllegalArgumentException(
                    "Price bars must be strictly ascending by timestamp. symbol=" + symbol
                        + " index=" + i + " timestamp=" + copy.get(i).timestamp());
            }
        }
        this.bars = copy;
    }

    public static PriceSeries of(String symbol, List<PriceBar> bars) {
        return new PriceSeries(symbol, bars);
    }

    @JsonProperty("symbol")
    public String symbol() { return symbol; }

    @JsonProperty("bars")
    public List<PriceBar> bars() { return bars; }

    public int size() { return bars.size(); }

    @JsonIgnore
    public boolean isEmpty() { return bars.isEmpty(); }

    /** Closing prices, oldest first. */
    public List<Double> closes() {
        List<Double> closes = new ArrayList<>(bars.size());
        for (PriceBar bar : bars) closes.add(bar.close());
        return closes;
    }

    /** Volumes, oldest first. */
    public List<Long> volumes() {
        List<Long> volumes = new ArrayList<>(bars.size());
        for (PriceBar bar : bars) volumes.add(bar.volume());
        return volumes;
    }

    @JsonIgnore
    public PriceBar latest() {
        if (bars.isEmpty()) throw new IllegalStateException("Empty price series. symbol=" + symbol);
        return bars.get(bars.size() - 1);
    }

    @Override
    public String toString() {
        return "PriceSeries[symbol=" + symbol + ", bars=" + bars.size() + "]";
    }
}
