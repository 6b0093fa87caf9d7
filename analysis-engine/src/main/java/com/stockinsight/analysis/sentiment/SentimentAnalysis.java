package com.stockinsight.analysis.sentiment;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stockinsight.common.model.NewsCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Sentiment metrics over the analysed news items.
 *
 * <p>{@code overall} is the mean item score in [-1, 1]; {@code score} is the same value on
 * the 0–100 scale. When no item could be analysed {@code noData} is set, the score is the
 * neutral 50 and confidence is 0.
 */
public record SentimentAnalysis(
    @JsonProperty("score") double score,
    @JsonProperty("overall") double overall,
    @JsonProperty("trend") SentimentTrend trend,
    @JsonProperty("direction") SentimentDirection direction,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("itemsAnalyzed") int itemsAnalyzed,
    @JsonProperty("itemsReceived") int itemsReceived,
    @JsonProperty("positiveRatio") double positiveRatio,
    @JsonProperty("negativeRatio") double negativeRatio,
    @JsonProperty("byCategory") Map<NewsCategory, Double> byCategory,
    @JsonProperty("noData") boolean noData
) {
    public SentimentAnalysis {
        byCategory = byCategory.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(byCategory));
    }

    public static SentimentAnalysis noData(int itemsReceived) {
        return new SentimentAnalysis(50.0, 0.0, SentimentTrend.NEUTRAL, SentimentDirection.STABLE,
            0.0, 0, itemsReceived, 0.0, 0.0, Map.of(), true);
    }
}
