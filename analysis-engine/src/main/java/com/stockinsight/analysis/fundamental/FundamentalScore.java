package com.stockinsight.analysis.fundamental;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stockinsight.common.model.FinancialIndicator;
import com.stockinsight.common.model.IndicatorGroup;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fundamental score with its breakdown. {@code indicatorsUsed} of
 * {@code indicatorsTotal} indicators contributed; the rest were absent upstream.
 */
public record FundamentalScore(
    @JsonProperty("score") double score,
    @JsonProperty("indicatorsUsed") int indicatorsUsed,
    @JsonProperty("indicatorsTotal") int indicatorsTotal,
    @JsonProperty("partialScores") Map<FinancialIndicator, Double> partialScores,
    @JsonProperty("groupScores") Map<IndicatorGroup, Double> groupScores
) {
    public FundamentalScore {
        partialScores = Collections.unmodifiableMap(new EnumMap<>(partialScores));
        groupScores = groupScores.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(groupScores));
    }
}
