package com.stockinsight.orchestrator.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stockinsight.common.model.Market;
import com.stockinsight.common.model.TaskState;

import java.time.Instant;

/** Read-only snapshot of an {@link AnalysisTask}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskView(
    @JsonProperty("taskId") String taskId,
    @JsonProperty("clientId") String clientId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("market") Market market,
    @JsonProperty("state") TaskState state,
    @JsonProperty("failureKind") FailureKind failureKind,
    @JsonProperty("error") String error,
    @JsonProperty("batchId") String batchId,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("updatedAt") Instant updatedAt
) {}
