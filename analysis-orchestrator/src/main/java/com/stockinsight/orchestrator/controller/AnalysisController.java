package com.stockinsight.orchestrator.controller;

import com.stockinsight.common.exception.ValidationException;
import com.stockinsight.common.model.Market;
import com.stockinsight.orchestrator.task.AnalysisOrchestrator;
import com.stockinsight.orchestrator.task.TaskView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/analysis")
public class AnalysisController {

    private final AnalysisOrchestrator orchestrator;

    public AnalysisController(AnalysisOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public Mono<ResponseEntity<Map<String, String>>> submit(@RequestBody AnalysisRequest request) {
        return Mono.fromCallable(() -> orchestrator.submitAnalysis(request.symbol(), parseMarket(request.market()),
                request.clientId(), !Boolean.FALSE.equals(request.streaming())))
            .map(taskId -> ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("taskId", taskId)));
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<Map<String, List<String>>>> submitBatch(@RequestBody BatchAnalysisRequest request) {
        return Mono.fromCallable(() -> orchestrator.submitBatchAnalysis(request.symbols(),
                parseMarket(request.market()), request.clientId(), !Boolean.FALSE.equals(request.streaming())))
            .map(taskIds -> ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("taskIds", taskIds)));
    }

    @GetMapping("/tasks/{taskId}")
    public Mono<TaskView> status(@PathVariable String taskId) {
        return Mono.fromCallable(() -> orchestrator.getTaskStatus(taskId));
    }

    @PostMapping("/tasks/{taskId}/ack")
    public Mono<ResponseEntity<Void>> acknowledge(@PathVariable String taskId) {
        return Mono.fromRunnable(() -> orchestrator.acknowledge(taskId))
            .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    /** Accepts enum names in any case, with {@code -} or {@code _}; blank means auto-detect. */
    static Market parseMarket(String market) {
        if (market == null || market.isBlank()) return null;
        String normalised = market.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Market.valueOf(normalised);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown market: " + market);
        }
    }
}
