package com.stockinsight.analysis.indicator;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MacdReading(
    @JsonProperty("macd") double macd,
    @JsonProperty("signal") double signal,
    @JsonProperty("histogram") double histogram,
    @JsonProperty("cross") MacdCross cross
) {}
