package com.stockinsight.analysis.indicator;

public enum MaTrend {
    BULLISH,
    BEARISH,
    MIXED
}
