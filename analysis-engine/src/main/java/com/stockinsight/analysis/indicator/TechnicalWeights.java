package com.stockinsight.analysis.indicator;

import com.stockinsight.common.exception.ConfigurationException;

/**
 * Relative weight of each indicator signal in the technical score. Weights need not sum
 * to one; the score divides by the total weight of the indicators actually computed.
 */
public record TechnicalWeights(double movingAverage, double rsi, double macd, double bollinger, double volume) {

    public TechnicalWeights {
        for (double w : new double[] {movingAverage, rsi, macd, bollinger, volume}) {
            if (!Double.isFinite(w) || w < 0) {
                throw new ConfigurationException("Technical indicator weights must be finite and non-negative");
            }
        }
        if (movingAverage + rsi + macd + bollinger + volume <= 0) {
            throw new ConfigurationException("At least one technical indicator weight must be positive");
        }
    }

    public static TechnicalWeights defaults() {
        return new TechnicalWeights(0.25, 0.20, 0.25, 0.15, 0.15);
    }

    public double weightOf(TechnicalIndicator indicator) {
        return switch (indicator) {
            case MOVING_AVERAGE -> movingAverage;
            case RSI            -> rsi;
            case MACD           -> macd;
            case BOLLINGER      -> bollinger;
            case VOLUME         -> volume;
        };
    }
}
