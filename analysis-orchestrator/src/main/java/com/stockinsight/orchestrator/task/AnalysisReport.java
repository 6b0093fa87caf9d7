package com.stockinsight.orchestrator.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stockinsight.analysis.fundamental.FundamentalScore;
import com.stockinsight.analysis.indicator.TechnicalSnapshot;
import com.stockinsight.analysis.sentiment.SentimentAnalysis;
import com.stockinsight.common.model.Market;
import com.stockinsight.common.model.ScoreResult;
import com.stockinsight.orchestrator.ai.Narrative;

import java.time.Instant;

/**
 * Payload of the {@code final_result} event. Category details are absent when missing, and
 * {@code name} when the data gateway has no display name for the symbol.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisReport(
    @JsonProperty("taskId") String taskId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("name") String name,
    @JsonProperty("market") Market market,
    @JsonProperty("scores") ScoreResult scores,
    @JsonProperty("technical") TechnicalSnapshot technical,
    @JsonProperty("fundamental") FundamentalScore fundamental,
    @JsonProperty("sentiment") SentimentAnalysis sentiment,
    @JsonProperty("narrative") Narrative narrative,
    @JsonProperty("dataQuality") DataQuality dataQuality,
    @JsonProperty("generatedAt") Instant generatedAt
) {
    @JsonProperty("partial")
    public boolean isPartial() {
        return scores.isPartial();
    }
}
