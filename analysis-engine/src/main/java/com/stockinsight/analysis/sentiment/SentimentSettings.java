package com.stockinsight.analysis.sentiment;

import com.stockinsight.common.exception.ConfigurationException;

/**
 * @param maxItems          news items analysed per symbol, newest first
 * @param maxContentLength  characters of each item's text fed to the lexicon
 */
public record SentimentSettings(int maxItems, int maxContentLength) {

    public SentimentSettings {
        if (maxItems <= 0) throw new ConfigurationException("sentiment max-items must be positive: " + maxItems);
        if (maxContentLength <= 0) {
            throw new ConfigurationException("sentiment max-content-length must be positive: " + maxContentLength);
        }
    }

    public static SentimentSettings defaults() {
        return new SentimentSettings(100, 500);
    }
}
