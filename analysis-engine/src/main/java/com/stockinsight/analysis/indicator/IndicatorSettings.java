package com.stockinsight.analysis.indicator;

import com.stockinsight.common.exception.ConfigurationException;

import java.util.List;

/**
 * Windows and spans of the technical indicators. Moving-average windows are kept in
 * ascending order, which is the order the trend classification compares them in.
 */
public record IndicatorSettings(
    int periodDays,
    List<Integer> maWindows,
    int rsiWindow,
    int macdFast,
    int macdSlow,
    int macdSignal,
    int bollingerWindow,
    double bollingerK,
    int volumeWindow,
    TechnicalWeights weights
) {
    public IndicatorSettings {
        if (periodDays <= 0) throw new ConfigurationException("analysis period must be positive: " + periodDays);
        if (maWindows == null || maWindows.isEmpty()) {
            throw new ConfigurationException("at least one moving-average window is required");
        }
        maWindows = maWindows.stream().sorted().distinct().toList();
        if (maWindows.get(0) <= 0) throw new ConfigurationException("moving-average windows must be positive");
        if (rsiWindow <= 0 || bollingerWindow <= 1 || volumeWindow <= 0) {
            throw new ConfigurationException("indicator windows must be positive");
        }
        if (macdFast <= 0 || macdSignal <= 0 || macdFast >= macdSlow) {
            throw new ConfigurationException(
                "MACD spans must satisfy 0 < fast < slow and signal > 0 (fast=" + macdFast + " slow=" + macdSlow + ")");
        }
        if (!Double.isFinite(bollingerK) || bollingerK <= 0) {
            throw new ConfigurationException("Bollinger band width must be positive: " + bollingerK);
        }
        if (weights == null) weights = TechnicalWeights.defaults();
    }

    public static IndicatorSettings defaults() {
        return new IndicatorSettings(180, List.of(5, 10, 20, 60), 14, 12, 26, 9, 20, 2.0, 20,
            TechnicalWeights.defaults());
    }
}
