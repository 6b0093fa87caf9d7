package com.stockinsight.orchestrator.controller;

import com.stockinsight.orchestrator.task.AnalysisOrchestrator;
import com.stockinsight.orchestrator.task.SystemStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/system")
public class SystemController {

    private final AnalysisOrchestrator orchestrator;

    public SystemController(AnalysisOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/status")
    public Mono<SystemStatus> status() {
        return Mono.fromCallable(orchestrator::getSystemStatus);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
