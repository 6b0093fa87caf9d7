package com.stockinsight.common.exception;

public class TaskNotFoundException extends AnalysisException {
    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("tasks", "No analysis task with id=" + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
