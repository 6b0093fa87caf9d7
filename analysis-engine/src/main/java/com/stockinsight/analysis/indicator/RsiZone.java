package com.stockinsight.analysis.indicator;

public enum RsiZone {
    OVERBOUGHT,
    NEUTRAL,
    OVERSOLD;

    public static RsiZone of(double rsi) {
        if (rsi > 70) return OVERBOUGHT;
        if (rsi < 30) return OVERSOLD;
        return NEUTRAL;
    }
}
