package com.stockinsight.orchestrator.task;

import com.stockinsight.common.exception.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of live and recently finished tasks.
 *
 * <p>A client has at most one unfinished task per symbol: registering a second one returns
 * the task already running. Finished tasks are kept for the retention period so their
 * status stays queryable, then dropped by {@link #purgeExpired()}.
 */
public class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private final Map<String, AnalysisTask> tasks = new ConcurrentHashMap<>();
    private final Map<String, AnalysisTask> activeByClientSymbol = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;

    public TaskRegistry(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * Registers {@code candidate} unless the same client already has an unfinished task for
     * the same symbol.
     *
     * @return the registered candidate, or the existing task it duplicates
     */
    public AnalysisTask registerOrGet(AnalysisTask candidate) {
        AnalysisTask winner = activeByClientSymbol.compute(candidate.dedupeKey(), (key, existing) ->
            existing != null && !existing.state().isTerminal() ? existing : candidate);
        if (winner == candidate) {
            tasks.put(candidate.taskId(), candidate);
        }
        return winner;
    }

    public Optional<AnalysisTask> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public AnalysisTask get(String taskId) {
        return find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /** Frees the task's dedupe slot once it has finished. */
    public void release(AnalysisTask task) {
        activeByClientSymbol.remove(task.dedupeKey(), task);
    }

    public void remove(AnalysisTask task) {
        tasks.remove(task.taskId(), task);
        release(task);
    }

    public List<AnalysisTask> forClient(String clientId) {
        return tasks.values().stream().filter(t -> t.clientId().equals(clientId)).toList();
    }

    public boolean hasTasks(String clientId) {
        return tasks.values().stream().anyMatch(t -> t.clientId().equals(clientId));
    }

    public int activeCount() {
        return (int) tasks.values().stream().filter(t -> !t.state().isTerminal()).count();
    }

    public int size() {
        return tasks.size();
    }

    /**
     * Drops finished tasks older than the retention period.
     *
     * @return the clients that lost their last task
     */
    public Set<String> purgeExpired() {
        Instant cutoff = clock.instant().minus(retention);
        Set<String> touched = new LinkedHashSet<>();
        for (AnalysisTask task : tasks.values()) {
            if (task.state().isTerminal() && task.updatedAt().isBefore(cutoff)) {
                remove(task);
                touched.add(task.clientId());
            }
        }
        if (!touched.isEmpty()) log.debug("[TaskRegistry] purged expired tasks clients={}", touched);
        touched.removeIf(this::hasTasks);
        return touched;
    }
}
