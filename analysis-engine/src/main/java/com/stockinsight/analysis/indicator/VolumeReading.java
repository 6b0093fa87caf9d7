package com.stockinsight.analysis.indicator;

import com.fasterxml.jackson.annotation.JsonProperty;

public record VolumeReading(
    @JsonProperty("ratio") double ratio,
    @JsonProperty("signal") VolumeSignal signal
) {}
