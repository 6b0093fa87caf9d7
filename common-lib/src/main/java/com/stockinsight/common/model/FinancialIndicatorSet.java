package com.stockinsight.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Immutable snapshot of the 25 {@link FinancialIndicator}s for one symbol.
 *
 * <p>Indicators the upstream did not report are absent, never zero. Non-finite
 * values are treated as absent on construction.
 */
public final class FinancialIndicatorSet {

    private final String symbol;
    private final Map<FinancialIndicator, Double> values;

    @JsonCreator
    public FinancialIndicatorSet(@JsonProperty("symbol") String symbol,
                                 @JsonProperty("values") Map<FinancialIndicator, Double> values) {
        this.symbol = symbol;
        EnumMap<FinancialIndicator, Double> copy = new EnumMap<>(FinancialIndicator.class);
        if (values != null) {
            values.forEach((indicator, value) -> {
                if (indicator != null && value != null && Double.isFinite(value)) {
                    copy.put(indicator, value);
                }
            });
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public static FinancialIndicatorSet of(String symbol, Map<FinancialIndicator, Double> values) {
        return new FinancialIndicatorSet(symbol, values);
    }

    public static FinancialIndicatorSet empty(String symbol) {
        return new FinancialIndicatorSet(symbol, Map.of());
    }

    @JsonProperty("symbol")
    public String symbol() { return symbol; }

    @JsonProperty("values")
    public Map<FinancialIndicator, Double> values() { return values; }

    public OptionalDouble get(FinancialIndicator indicator) {
        Double v = values.get(indicator);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public boolean isPresent(FinancialIndicator indicator) {
        return values.containsKey(indicator);
    }

    public int presentCount() { return values.size(); }

    @Override
    public String toString() {
        return "FinancialIndicatorSet[symbol=" + symbol + ", present=" + values.size() + "]";
    }
}
