package com.stockinsight.orchestrator.controller;

import com.stockinsight.common.exception.ValidationException;
import com.stockinsight.orchestrator.stream.StreamBroadcaster;
import com.stockinsight.orchestrator.stream.StreamEvent;
import com.stockinsight.orchestrator.task.OrchestratorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * SSE binding of the event stream. Heartbeat comments are interleaved so idle
 * connections stay open; they are not stream events.
 */
@RestController
@RequestMapping("/api/v1/stream")
public class StreamController {

    private static final Logger log = LoggerFactory.getLogger(StreamController.class);

    private final StreamBroadcaster broadcaster;
    private final OrchestratorSettings settings;

    public StreamController(StreamBroadcaster broadcaster, OrchestratorSettings settings) {
        this.broadcaster = broadcaster;
        this.settings = settings;
    }

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<StreamEvent>> stream(@RequestParam String clientId) {
        if (clientId.isBlank()) throw new ValidationException("clientId is required");
        log.info("SSE stream client connected clientId={}", clientId);

        Flux<ServerSentEvent<StreamEvent>> events = broadcaster.subscribe(clientId)
            .map(event -> ServerSentEvent.<StreamEvent>builder()
                .event(event.type().wireName())
                .data(event)
                .build());
        Flux<ServerSentEvent<StreamEvent>> heartbeats = Flux.interval(settings.heartbeatInterval())
            .onBackpressureDrop()
            .map(tick -> ServerSentEvent.<StreamEvent>builder().comment("heartbeat").build());

        // Prefetch of one keeps a slow consumer's backlog in the client channel, where the
        // drop-oldest policy applies.
        return events.publish(shared -> Flux.merge(1, shared, heartbeats.takeUntilOther(shared.ignoreElements())), 1);
    }
}
