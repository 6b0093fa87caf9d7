package com.stockinsight.orchestrator.task;

/** Classification attached to a failed task and to its {@code error} stream event. */
public enum FailureKind {
    /** No data category could be fetched. */
    DATA_UNAVAILABLE,
    /** Data arrived but no category could be scored. */
    SCORING_FAILED,
    /** The owning client disconnected. */
    CANCELLED,
    INTERNAL
}
