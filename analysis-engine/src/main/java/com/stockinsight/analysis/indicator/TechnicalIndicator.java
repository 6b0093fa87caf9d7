package com.stockinsight.analysis.indicator;

/** Indicators that contribute a signal to the technical score. */
public enum TechnicalIndicator {
    MOVING_AVERAGE,
    RSI,
    MACD,
    BOLLINGER,
    VOLUME
}
