package com.stockinsight.orchestrator.task;

import com.stockinsight.common.model.TaskState;
import com.stockinsight.marketdata.symbol.ResolvedSymbol;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.Objects;

/**
 * One analysis of one symbol for one client.
 *
 * <p>State only moves forward ({@link TaskState#canTransitionTo}); an illegal move throws
 * {@link IllegalStateException}. The first terminal transition wins, which is what keeps a
 * cancelled task from also completing.
 */
public final class AnalysisTask {

    private final String taskId;
    private final String clientId;
    private final ResolvedSymbol symbol;
    private final boolean streaming;
    private final String batchId;
    private final Instant createdAt;
    private final Sinks.Empty<Void> cancellation = Sinks.empty();

    private TaskState state = TaskState.QUEUED;
    private Instant updatedAt;
    private FailureKind failureKind;
    private String error;
    private Double composite;

    public AnalysisTask(String taskId, String clientId, ResolvedSymbol symbol,
                        boolean streaming, String batchId, Instant createdAt) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.streaming = streaming;
        this.batchId = batchId;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }

    public String taskId() { return taskId; }

    public String clientId() { return clientId; }

    public ResolvedSymbol symbol() { return symbol; }

    public boolean streaming() { return streaming; }

    public String batchId() { return batchId; }

    public Instant createdAt() { return createdAt; }

    public synchronized TaskState state() { return state; }

    public synchronized Instant updatedAt() { return updatedAt; }

    public synchronized FailureKind failureKind() { return failureKind; }

    public synchronized String error() { return error; }

    public synchronized Double composite() { return composite; }

    /** Moves to a non-terminal or {@code DONE} state. */
    public synchronized void advance(TaskState next, Instant at) {
        if (next == TaskState.FAILED) throw new IllegalArgumentException("use fail() to fail a task");
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Task " + taskId + " cannot move from " + state + " to " + next);
        }
        state = next;
        updatedAt = at;
    }

    /** @return {@code false} if the task had already reached a terminal state */
    public synchronized boolean complete(double compositeScore, Instant at) {
        if (!state.canTransitionTo(TaskState.DONE)) return false;
        state = TaskState.DONE;
        composite = compositeScore;
        updatedAt = at;
        return true;
    }

    /** @return {@code false} if the task had already reached a terminal state */
    public synchronized boolean fail(FailureKind kind, String message, Instant at) {
        if (state.isTerminal()) return false;
        state = TaskState.FAILED;
        failureKind = kind;
        error = message;
        updatedAt = at;
        return true;
    }

    /** Stops the task's pipeline, including any AI stream it is consuming. */
    public void cancel() {
        cancellation.tryEmitEmpty();
    }

    Mono<Void> cancellation() {
        return cancellation.asMono();
    }

    public String dedupeKey() {
        return clientId + "|" + symbol.cacheKey();
    }

    public synchronized TaskView view() {
        return new TaskView(taskId, clientId, symbol.symbol(), symbol.market(), state,
            failureKind, error, batchId, createdAt, updatedAt);
    }
}
