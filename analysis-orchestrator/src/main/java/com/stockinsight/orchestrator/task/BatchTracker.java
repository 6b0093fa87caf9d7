package com.stockinsight.orchestrator.task;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Counts the outcomes of one batch. Each task is registered before it is queued, including
 * an existing task the batch was deduplicated onto. The batch is finished once it is sealed
 * and every registered task reported. Reporting the same task twice has no effect.
 */
final class BatchTracker {

    private final String batchId;
    private final String clientId;
    private final Set<String> pending = new HashSet<>();
    private int total;
    private int succeeded;
    private int failed;
    private double compositeSum;
    private boolean sealed;
    private boolean finished;

    BatchTracker(String batchId, String clientId) {
        this.batchId = batchId;
        this.clientId = clientId;
    }

    String batchId() { return batchId; }

    String clientId() { return clientId; }

    synchronized void register(String taskId) {
        if (pending.add(taskId)) total++;
    }

    /** @return {@code true} if this call finished the batch */
    synchronized boolean seal() {
        sealed = true;
        return checkFinished();
    }

    /** @return {@code true} if this outcome finished the batch */
    synchronized boolean record(String taskId, Double composite) {
        if (!pending.remove(taskId)) return false;
        if (composite != null) {
            succeeded++;
            compositeSum += composite;
        } else {
            failed++;
        }
        return checkFinished();
    }

    synchronized String summary() {
        String average = succeeded == 0 ? "n/a" : String.format(Locale.ROOT, "%.1f", compositeSum / succeeded);
        return String.format(Locale.ROOT, "Batch %s finished: %d tasks, %d succeeded, %d failed, average composite %s",
            batchId, total, succeeded, failed, average);
    }

    private boolean checkFinished() {
        if (finished || !sealed || !pending.isEmpty() || total == 0) return false;
        finished = true;
        return true;
    }
}
