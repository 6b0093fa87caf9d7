package com.stockinsight.analysis.indicator;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Indicators computed from one price series plus the resulting technical score.
 *
 * <p>A reading is {@code null} when its window exceeded the available bars; the indicator
 * is then listed in {@code omitted} and did not contribute to {@code score}.
 * {@code movingAverages} holds only the windows that could be computed, ascending.
 */
public record TechnicalSnapshot(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("barsUsed") int barsUsed,
    @JsonProperty("movingAverages") Map<Integer, Double> movingAverages,
    @JsonProperty("maTrend") MaTrend maTrend,
    @JsonProperty("rsi") RsiReading rsi,
    @JsonProperty("macd") MacdReading macd,
    @JsonProperty("bollinger") BollingerReading bollinger,
    @JsonProperty("volume") VolumeReading volume,
    @JsonProperty("priceSummary") PriceSummary priceSummary,
    @JsonProperty("omitted") Set<TechnicalIndicator> omitted,
    @JsonProperty("score") double score
) {
    public TechnicalSnapshot {
        movingAverages = Collections.unmodifiableMap(new LinkedHashMap<>(movingAverages));
        omitted = omitted.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(omitted));
    }
}
