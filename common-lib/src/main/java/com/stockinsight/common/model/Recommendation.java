package com.stockinsight.common.model;

/**
 * Discrete recommendation derived from the composite score, strongest first.
 */
public enum Recommendation {
    STRONG_BUY("Strong Buy"),
    BUY("Buy"),
    HOLD("Hold"),
    SELL("Sell"),
    STRONG_SELL("Strong Sell");

    private final String label;

    Recommendation(String label) {
        this.label = label;
    }

    public String label() { return label; }
}
