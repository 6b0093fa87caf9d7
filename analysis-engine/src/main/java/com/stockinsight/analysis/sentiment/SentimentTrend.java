package com.stockinsight.analysis.sentiment;

/** Label of the overall sentiment in [-1, 1]. */
public enum SentimentTrend {
    VERY_POSITIVE,
    POSITIVE,
    NEUTRAL,
    NEGATIVE,
    VERY_NEGATIVE;

    public static SentimentTrend of(double overall) {
        if (overall > 0.3)  return VERY_POSITIVE;
        if (overall > 0.1)  return POSITIVE;
        if (overall > -0.1) return NEUTRAL;
        if (overall > -0.3) return NEGATIVE;
        return VERY_NEGATIVE;
    }
}
