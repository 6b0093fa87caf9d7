package com.stockinsight.orchestrator.task;

import com.stockinsight.common.exception.ValidationException;
import com.stockinsight.common.model.Market;
import com.stockinsight.common.model.TaskState;
import com.stockinsight.common.trace.TraceContextUtil;
import com.stockinsight.marketdata.service.MarketDataService;
import com.stockinsight.marketdata.symbol.MarketResolver;
import com.stockinsight.marketdata.symbol.ResolvedSymbol;
import com.stockinsight.orchestrator.ai.NarrativeService;
import com.stockinsight.orchestrator.logger.AnalysisFlowLogger;
import com.stockinsight.orchestrator.stream.StreamBroadcaster;
import com.stockinsight.orchestrator.stream.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point of the analysis engine: accepts single and batch requests, runs tasks on a
 * bounded worker pool and owns every task's lifecycle.
 *
 * <p>Submitted tasks go through one queue drained with {@code flatMap} at a concurrency of
 * {@link OrchestratorSettings#workerPoolSize()}, so a large batch never runs more tasks at
 * once than that. Each task ends with exactly one {@code final_result} or {@code error}
 * event, except when its client disconnects: the task is then cancelled silently, which
 * also cancels any AI stream it is consuming.
 */
public class AnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    private final TaskPipeline pipeline;
    private final TaskRegistry registry;
    private final StreamBroadcaster broadcaster;
    private final MarketDataService marketData;
    private final NarrativeService narrativeService;
    private final AnalysisFlowLogger flowLogger;
    private final OrchestratorSettings settings;
    private final Clock clock;

    private final Sinks.Many<AnalysisTask> queue = Sinks.many().unicast().onBackpressureBuffer();
    private final Map<String, BatchTracker> batches = new ConcurrentHashMap<>();
    private final Disposable worker;

    public AnalysisOrchestrator(TaskPipeline pipeline,
                                TaskRegistry registry,
                                StreamBroadcaster broadcaster,
                                MarketDataService marketData,
                                NarrativeService narrativeService,
                                AnalysisFlowLogger flowLogger,
                                OrchestratorSettings settings,
                                Clock clock) {
        this.pipeline = pipeline;
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.marketData = marketData;
        this.narrativeService = narrativeService;
        this.flowLogger = flowLogger;
        this.settings = settings;
        this.clock = clock;

        broadcaster.onDisconnect(this::cancelClient);
        this.worker = queue.asFlux()
            .flatMap(this::runTask, settings.workerPoolSize())
            .subscribe();
        log.info("[Orchestrator] worker pool started size={}", settings.workerPoolSize());
    }

    /**
     * @param market {@code null} to detect the market from the symbol
     * @return id of the new task, or of the client's unfinished task for the same symbol
     */
    public String submitAnalysis(String symbol, Market market, String clientId, boolean streaming) {
        requireClient(clientId);
        ResolvedSymbol resolved = MarketResolver.resolve(symbol, market);
        return schedule(resolved, clientId, streaming, null).taskId();
    }

    /**
     * Schedules one task per distinct symbol. Every symbol is validated before anything is
     * scheduled. A {@code log} event summarising the outcomes follows the batch's last task.
     */
    public List<String> submitBatchAnalysis(List<String> symbols, Market market, String clientId, boolean streaming) {
        requireClient(clientId);
        if (symbols == null || symbols.isEmpty()) throw new ValidationException("Batch contains no symbols");
        if (symbols.size() > settings.batchMaxSymbols()) {
            throw new ValidationException("Batch of " + symbols.size() + " symbols exceeds the limit of "
                + settings.batchMaxSymbols());
        }
        List<ResolvedSymbol> resolved = symbols.stream().map(s -> MarketResolver.resolve(s, market)).toList();

        BatchTracker batch = new BatchTracker(UUID.randomUUID().toString(), clientId);
        batches.put(batch.batchId(), batch);
        List<String> taskIds = new ArrayList<>(resolved.size());
        for (ResolvedSymbol symbol : resolved) {
            taskIds.add(schedule(symbol, clientId, streaming, batch).taskId());
        }
        log.info("[Orchestrator] BATCH_SUBMITTED batchId={} clientId={} symbols={}",
            batch.batchId(), clientId, taskIds.size());
        if (batch.seal()) finishBatch(batch);
        return taskIds;
    }

    public TaskView getTaskStatus(String taskId) {
        purgeExpired();
        return registry.get(taskId).view();
    }

    /** Destroys a finished task once its client has consumed the result. */
    public void acknowledge(String taskId) {
        AnalysisTask task = registry.get(taskId);
        TaskState state = task.state();
        if (!state.isTerminal()) {
            throw new ValidationException("Task " + taskId + " is still " + state + " and cannot be acknowledged");
        }
        registry.remove(task);
        if (!registry.hasTasks(task.clientId())) broadcaster.releaseIfDetached(task.clientId());
        log.debug("[Orchestrator] TASK_ACKNOWLEDGED taskId={}", taskId);
    }

    /** Cancels and forgets every task of a client that went away. */
    public void cancelClient(String clientId) {
        List<AnalysisTask> tasks = registry.forClient(clientId);
        for (AnalysisTask task : tasks) {
            if (task.fail(FailureKind.CANCELLED, "Client disconnected", clock.instant())) {
                flowLogger.logFailed(task.taskId(), task.symbol().symbol(), FailureKind.CANCELLED.name(),
                    "client disconnected");
            }
            task.cancel();
            registry.remove(task);
        }
        batches.values().removeIf(b -> b.clientId().equals(clientId));
        // events published while the tasks were still live may have reopened the channel
        broadcaster.releaseIfDetached(clientId);
        if (!tasks.isEmpty()) {
            log.info("[Orchestrator] CLIENT_TASKS_CANCELLED clientId={} tasks={}", clientId, tasks.size());
        }
    }

    public SystemStatus getSystemStatus() {
        purgeExpired();
        return new SystemStatus(
            registry.activeCount(),
            registry.size(),
            broadcaster.connectedClients(),
            settings.workerPoolSize(),
            marketData.inFlightCount(),
            narrativeService.configuredProviders(),
            clock.instant());
    }

    public void shutdown() {
        queue.tryEmitComplete();
        worker.dispose();
        log.info("[Orchestrator] worker pool stopped");
    }

    // ── scheduling ────────────────────────────────────────────────────────────

    /** @param batch batch the task counts towards, {@code null} for a single analysis */
    private AnalysisTask schedule(ResolvedSymbol symbol, String clientId, boolean streaming, BatchTracker batch) {
        purgeExpired();
        AnalysisTask candidate = new AnalysisTask(UUID.randomUUID().toString(), clientId, symbol,
            streaming, batch == null ? null : batch.batchId(), clock.instant());
        AnalysisTask task = registry.registerOrGet(candidate);
        if (batch != null) joinBatch(batch, task);
        if (task != candidate) {
            log.info("[Orchestrator] TASK_DEDUPLICATED clientId={} symbol={} existingTaskId={}",
                clientId, symbol.cacheKey(), task.taskId());
            return task;
        }
        flowLogger.logWithTraceId(AnalysisFlowLogger.TASK_QUEUED, task.taskId());
        broadcaster.publish(StreamEvent.progress(clientId, task.taskId(), clock.instant(),
            TaskState.QUEUED, 0, "Queued analysis of " + symbol.symbol()));
        enqueue(task);
        return task;
    }

    private synchronized void enqueue(AnalysisTask task) {
        Sinks.EmitResult result = queue.tryEmitNext(task);
        if (result.isFailure()) {
            log.error("[Orchestrator] Could not queue taskId={} result={}", task.taskId(), result);
            fail(task, new IllegalStateException("task queue rejected the task: " + result));
        }
    }

    private Mono<Void> runTask(AnalysisTask task) {
        Mono<Void> body = Mono.defer(() -> {
                if (task.state() != TaskState.QUEUED) return Mono.<Void>empty();
                return pipeline.run(task)
                    .takeUntilOther(task.cancellation())
                    .doOnNext(report -> complete(task, report))
                    .then();
            })
            .onErrorResume(e -> {
                fail(task, e);
                return Mono.empty();
            });
        return TraceContextUtil.withTraceId(body, task.taskId());
    }

    // ── terminal transitions ──────────────────────────────────────────────────

    private void complete(AnalysisTask task, AnalysisReport report) {
        if (!task.complete(report.scores().composite(), clock.instant())) return;
        registry.release(task);
        broadcaster.publish(StreamEvent.progress(task.clientId(), task.taskId(), clock.instant(),
            TaskState.DONE, 100, "Analysis complete"));
        broadcaster.publish(StreamEvent.finalResult(task.clientId(), task.taskId(), clock.instant(), report));
        flowLogger.logCompleted(task.taskId(), task.symbol().symbol(), report.scores().composite(),
            report.scores().recommendation().name(), report.isPartial(), report.narrative().source());
        recordBatchOutcome(task, report.scores().composite());
    }

    private void fail(AnalysisTask task, Throwable error) {
        FailureKind kind;
        String message;
        if (error instanceof TaskFailedException failure) {
            kind = failure.getKind();
            message = failure.getReason();
        } else {
            kind = FailureKind.INTERNAL;
            message = "Internal error while analysing " + task.symbol().symbol();
        }
        if (!task.fail(kind, message, clock.instant())) return;
        if (kind == FailureKind.INTERNAL) {
            log.error("[Orchestrator] Task failed unexpectedly taskId={}", task.taskId(), error);
        }
        registry.release(task);
        broadcaster.publish(StreamEvent.error(task.clientId(), task.taskId(), clock.instant(), kind.name(), message));
        flowLogger.logFailed(task.taskId(), task.symbol().symbol(), kind.name(), message);
        recordBatchOutcome(task, null);
    }

    /**
     * Registers the task with the batch before it can run. A deduplicated task may already
     * be terminal, in which case its outcome is recorded at once.
     */
    private void joinBatch(BatchTracker batch, AnalysisTask task) {
        batch.register(task.taskId());
        if (task.state().isTerminal() && batch.record(task.taskId(), task.composite())) finishBatch(batch);
    }

    /** A task counts towards every batch of its client that registered it. */
    private void recordBatchOutcome(AnalysisTask task, Double composite) {
        for (BatchTracker batch : batches.values()) {
            if (batch.clientId().equals(task.clientId()) && batch.record(task.taskId(), composite)) {
                finishBatch(batch);
            }
        }
    }

    private void finishBatch(BatchTracker batch) {
        if (!batches.remove(batch.batchId(), batch)) return;
        String summary = batch.summary();
        log.info("[Orchestrator] BATCH_FINISHED {}", summary);
        broadcaster.publish(StreamEvent.log(batch.clientId(), null, clock.instant(), "INFO", summary));
    }

    private void purgeExpired() {
        registry.purgeExpired().forEach(broadcaster::releaseIfDetached);
    }

    private static void requireClient(String clientId) {
        if (clientId == null || clientId.isBlank()) throw new ValidationException("clientId is required");
    }
}
