package com.stockinsight.orchestrator.task;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record SystemStatus(
    @JsonProperty("activeTasks") int activeTasks,
    @JsonProperty("retainedTasks") int retainedTasks,
    @JsonProperty("connectedClients") int connectedClients,
    @JsonProperty("workerPoolSize") int workerPoolSize,
    @JsonProperty("inFlightFetches") int inFlightFetches,
    @JsonProperty("aiProviders") List<String> aiProviders,
    @JsonProperty("timestamp") Instant timestamp
) {}
