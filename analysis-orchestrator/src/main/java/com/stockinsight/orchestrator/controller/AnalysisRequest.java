package com.stockinsight.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of a single analysis request. {@code market} and {@code streaming} are optional. */
public record AnalysisRequest(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("market") String market,
    @JsonProperty("clientId") String clientId,
    @JsonProperty("streaming") Boolean streaming
) {}
