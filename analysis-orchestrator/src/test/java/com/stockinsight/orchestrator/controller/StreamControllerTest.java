package com.stockinsight.orchestrator.controller;

import com.stockinsight.common.exception.ValidationException;
import com.stockinsight.orchestrator.MutableClock;
import com.stockinsight.orchestrator.stream.StreamBroadcaster;
import com.stockinsight.orchestrator.stream.StreamEvent;
import com.stockinsight.orchestrator.task.OrchestratorSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class StreamControllerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-03T09:30:00Z"));
    private final StreamBroadcaster broadcaster = new StreamBroadcaster(16, clock);
    private final StreamController controller = new StreamController(broadcaster,
        new OrchestratorSettings(3, 10, Duration.ofMinutes(10), 16, Duration.ofMillis(50)));

    @Test
    @DisplayName("names each SSE after its event type and interleaves heartbeat comments")
    void eventsAndHeartbeats() {
        broadcaster.publish(StreamEvent.log("c1", "t1", clock.instant(), "INFO", "hello"));

        StepVerifier.create(controller.stream("c1"))
            .assertNext(sse -> assertEquals("connected", sse.event()))
            .assertNext(sse -> {
                assertEquals("log", sse.event());
                assertEquals("t1", sse.data().taskId());
            })
            .assertNext(sse -> {
                assertNull(sse.data());
                assertEquals("heartbeat", sse.comment());
            })
            .thenCancel()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("a consumer that stops reading leaves its backlog in the channel, which drops the oldest")
    void slowConsumerBacklogStaysInChannel() {
        StepVerifier.create(controller.stream("c1"), 1)
            .assertNext(sse -> assertEquals("connected", sse.event()))
            .then(() -> {
                for (int i = 0; i < 40; i++) {
                    broadcaster.publish(StreamEvent.log("c1", "t1", clock.instant(), "INFO", "line " + i));
                }
            })
            .then(() -> {
                assertTrue(broadcaster.droppedEvents("c1") > 0);
                assertEquals(16, broadcaster.pendingEvents("c1"));
            })
            .thenCancel()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("closing the stream disconnects the client")
    void cancelDisconnects() {
        List<String> disconnected = new CopyOnWriteArrayList<>();
        broadcaster.onDisconnect(disconnected::add);

        StepVerifier.create(controller.stream("c1"))
            .expectNextCount(1)
            .thenCancel()
            .verify(Duration.ofSeconds(5));

        assertEquals(List.of("c1"), disconnected);
    }

    @Test
    void rejectsBlankClientId() {
        assertThrows(ValidationException.class, () -> controller.stream(" "));
    }
}
