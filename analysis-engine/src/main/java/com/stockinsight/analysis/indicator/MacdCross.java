package com.stockinsight.analysis.indicator;

/** MACD line versus signal line over the two most recent bars. */
public enum MacdCross {
    BULLISH_CROSS,
    BEARISH_CROSS,
    NONE
}
