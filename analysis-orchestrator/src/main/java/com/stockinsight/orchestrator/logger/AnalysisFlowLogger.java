package com.stockinsight.orchestrator.logger;

import com.stockinsight.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs the lifecycle stages of an analysis task. Pure side effects; nothing here changes
 * what the pipeline does.
 *
 * <p>Stages, in order: {@link #TASK_QUEUED}, {@link #DATA_FETCHED}, {@link #SCORES_COMPUTED},
 * {@link #NARRATIVE_STARTED}, then {@link #TASK_COMPLETED} or {@link #TASK_FAILED}.
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(AnalysisFlowLogger.DATA_FETCHED))
 * </pre>
 */
@Component
public class AnalysisFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AnalysisFlowLogger.class);

    public static final String TASK_QUEUED       = "TASK_QUEUED";
    public static final String DATA_FETCHED      = "DATA_FETCHED";
    public static final String SCORES_COMPUTED   = "SCORES_COMPUTED";
    public static final String NARRATIVE_STARTED = "NARRATIVE_STARTED";
    public static final String TASK_COMPLETED    = "TASK_COMPLETED";
    public static final String TASK_FAILED       = "TASK_FAILED";

    /**
     * Returns a {@code doOnEach} consumer logging {@code stageName} on each {@code onNext}.
     * The trace id is read from the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[AnalysisFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /** For call sites outside a reactive chain, where the task id is at hand. */
    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[AnalysisFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    public void logCompleted(String traceId, String symbol, double composite, String recommendation,
                             boolean partial, String narrativeSource) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[AnalysisFlow] stage={} symbol={} composite={} recommendation={} partial={} narrative={} traceId={}",
                TASK_COMPLETED, symbol, String.format("%.2f", composite), recommendation, partial,
                narrativeSource, traceId)
        );
    }

    public void logFailed(String traceId, String symbol, String kind, String reason) {
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("[AnalysisFlow] stage={} symbol={} kind={} reason={} traceId={}",
                TASK_FAILED, symbol, kind, reason, traceId)
        );
    }
}
