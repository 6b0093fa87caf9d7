package com.stockinsight.orchestrator.task;

import com.stockinsight.common.exception.AnalysisException;

/** Unrecoverable task step; the message is shown to the client as-is. */
public class TaskFailedException extends AnalysisException {
    private final FailureKind kind;
    private final String reason;

    public TaskFailedException(FailureKind kind, String reason) {
        super("task", reason);
        this.kind = kind;
        this.reason = reason;
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getReason() {
        return reason;
    }
}
