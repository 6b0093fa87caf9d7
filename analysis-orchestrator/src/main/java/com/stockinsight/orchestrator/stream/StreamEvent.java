package com.stockinsight.orchestrator.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stockinsight.common.model.DataCategory;
import com.stockinsight.common.model.TaskState;

import java.time.Instant;
import java.util.Objects;

/**
 * One event on a client's stream. {@code taskId} is {@code null} for connection-level
 * events; {@code payload} is one of the nested payload records, or the final report.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamEvent(
    @JsonProperty("type") StreamEventType type,
    @JsonProperty("clientId") String clientId,
    @JsonProperty("taskId") String taskId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("payload") Object payload
) {
    public StreamEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(clientId, "clientId");
        if (timestamp == null) timestamp = Instant.now();
    }

    public record Connected(@JsonProperty("clientId") String clientId) {}

    public record Log(@JsonProperty("level") String level, @JsonProperty("message") String message) {}

    public record Progress(@JsonProperty("state") TaskState state,
                           @JsonProperty("percent") int percent,
                           @JsonProperty("message") String message) {}

    public record ScoreUpdate(@JsonProperty("category") DataCategory category,
                              @JsonProperty("subScore") Double subScore,
                              @JsonProperty("runningComposite") Double runningComposite,
                              @JsonProperty("scoredCategories") int scoredCategories) {}

    public record AiToken(@JsonProperty("provider") String provider, @JsonProperty("text") String text) {}

    public record Failure(@JsonProperty("kind") String kind, @JsonProperty("message") String message) {}

    public static StreamEvent connected(String clientId, Instant at) {
        return new StreamEvent(StreamEventType.CONNECTED, clientId, null, at, new Connected(clientId));
    }

    public static StreamEvent log(String clientId, String taskId, Instant at, String level, String message) {
        return new StreamEvent(StreamEventType.LOG, clientId, taskId, at, new Log(level, message));
    }

    public static StreamEvent progress(String clientId, String taskId, Instant at,
                                       TaskState state, int percent, String message) {
        return new StreamEvent(StreamEventType.PROGRESS, clientId, taskId, at, new Progress(state, percent, message));
    }

    public static StreamEvent scoreUpdate(String clientId, String taskId, Instant at, ScoreUpdate update) {
        return new StreamEvent(StreamEventType.SCORE_UPDATE, clientId, taskId, at, update);
    }

    public static StreamEvent aiToken(String clientId, String taskId, Instant at, String provider, String text) {
        return new StreamEvent(StreamEventType.AI_TOKEN, clientId, taskId, at, new AiToken(provider, text));
    }

    public static StreamEvent finalResult(String clientId, String taskId, Instant at, Object report) {
        return new StreamEvent(StreamEventType.FINAL_RESULT, clientId, taskId, at, report);
    }

    public static StreamEvent error(String clientId, String taskId, Instant at, String kind, String message) {
        return new StreamEvent(StreamEventType.ERROR, clientId, taskId, at, new Failure(kind, message));
    }
}
