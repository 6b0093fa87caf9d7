package com.stockinsight.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BatchAnalysisRequest(
    @JsonProperty("symbols") List<String> symbols,
    @JsonProperty("market") String market,
    @JsonProperty("clientId") String clientId,
    @JsonProperty("streaming") Boolean streaming
) {}
