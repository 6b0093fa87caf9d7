package com.stockinsight.common.model;

/**
 * Lifecycle of one analysis task. States are declared in forward order; a task may only
 * move to a later state, or to {@link #FAILED} from any non-terminal state.
 */
public enum TaskState {
    QUEUED,
    FETCHING,
    SCORING,
    NARRATING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean canTransitionTo(TaskState next) {
        if (next == null || isTerminal()) return false;
        if (next == FAILED) return true;
        return next.ordinal() > ordinal();
    }
}
