package com.stockinsight.orchestrator.stream;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tag of a {@link StreamEvent}. {@link #FINAL_RESULT} and {@link #ERROR} close a task's
 * event sequence and are never dropped by the broadcaster.
 */
public enum StreamEventType {
    CONNECTED("connected"),
    LOG("log"),
    PROGRESS("progress"),
    SCORE_UPDATE("score_update"),
    AI_TOKEN("ai_token"),
    FINAL_RESULT("final_result"),
    ERROR("error");

    private final String wireName;

    StreamEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == FINAL_RESULT || this == ERROR;
    }
}
