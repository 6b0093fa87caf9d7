package com.stockinsight.orchestrator.stream;

import com.stockinsight.common.model.TaskState;
import com.stockinsight.orchestrator.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class StreamBroadcasterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-03T09:30:00Z"));

    private StreamEvent log(String clientId, String message) {
        return StreamEvent.log(clientId, "t1", clock.instant(), "INFO", message);
    }

    private static String messageOf(StreamEvent event) {
        return ((StreamEvent.Log) event.payload()).message();
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        @DisplayName("connected comes first, then the backlog, then live events, all in publish order")
        void connectedFirstThenInOrder() {
            StreamBroadcaster broadcaster = new StreamBroadcaster(16, clock);
            broadcaster.publish(log("c1", "one"));
            broadcaster.publish(log("c1", "two"));

            StepVerifier.create(broadcaster.subscribe("c1"))
                .assertNext(e -> assertEquals(StreamEventType.CONNECTED, e.type()))
                .assertNext(e -> assertEquals("one", messageOf(e)))
                .assertNext(e -> assertEquals("two", messageOf(e)))
                .then(() -> broadcaster.publish(log("c1", "three")))
                .assertNext(e -> assertEquals("three", messageOf(e)))
                .thenCancel()
                .verify();
        }

        @Test
        @DisplayName("events of one client never reach another")
        void isolatedPerClient() {
            StreamBroadcaster broadcaster = new StreamBroadcaster(16, clock);
            broadcaster.publish(log("other", "not yours"));

            StepVerifier.create(broadcaster.subscribe("c1"))
                .assertNext(e -> assertEquals(StreamEventType.CONNECTED, e.type()))
                .expectNoEvent(Duration.ofMillis(50))
                .thenCancel()
                .verify();
            assertEquals(1, broadcaster.pendingEvents("other"));
        }
    }

    @Nested
    @DisplayName("slow consumer")
    class SlowConsumer {

        @Test
        @DisplayName("flooding past capacity drops old progress events but keeps the final result")
        void finalResultSurvivesFlood() {
            StreamBroadcaster broadcaster = new StreamBroadcaster(8, clock);
            broadcaster.publish(StreamEvent.finalResult("c1", "t0", clock.instant(), "earlier report"));
            for (int i = 0; i < 100; i++) {
                broadcaster.publish(StreamEvent.progress("c1", "t1", clock.instant(), TaskState.FETCHING, i, "p" + i));
            }
            broadcaster.publish(StreamEvent.finalResult("c1", "t1", clock.instant(), "report"));
            for (int i = 0; i < 20; i++) {
                broadcaster.publish(log("c1", "late" + i));
            }

            assertEquals(8, broadcaster.pendingEvents("c1"));
            assertTrue(broadcaster.droppedEvents("c1") > 0);

            List<StreamEvent> received = new ArrayList<>();
            StepVerifier.create(broadcaster.subscribe("c1"))
                .recordWith(() -> received)
                .expectNextCount(9)
                .thenCancel()
                .verify();

            List<Object> finals = received.stream()
                .filter(e -> e.type() == StreamEventType.FINAL_RESULT)
                .map(StreamEvent::payload)
                .toList();
            assertEquals(List.of("earlier report", "report"), finals);
        }

        @Test
        @DisplayName("delivery follows downstream demand")
        void respectsDemand() {
            StreamBroadcaster broadcaster = new StreamBroadcaster(16, clock);
            for (int i = 0; i < 5; i++) broadcaster.publish(log("c1", "m" + i));

            StepVerifier.create(broadcaster.subscribe("c1"), 2)
                .expectNextCount(2)
                .then(() -> assertEquals(4, broadcaster.pendingEvents("c1")))
                .thenRequest(4)
                .expectNextCount(4)
                .thenCancel()
                .verify();
        }
    }

    @Nested
    @DisplayName("disconnect")
    class Disconnect {

        @Test
        @DisplayName("cancelling the subscription notifies listeners and discards the queue")
        void cancelNotifies() {
            StreamBroadcaster broadcaster = new StreamBroadcaster(16, clock);
            List<String> disconnected = new CopyOnWriteArrayList<>();
            broadcaster.onDisconnect(disconnected::add);

            StepVerifier.create(broadcaster.subscribe("c1"))
                .expectNextCount(1)
                .then(() -> assertEquals(1, broadcaster.connectedClients()))
                .thenCancel()
                .verify();

            assertEquals(List.of("c1"), disconnected);
            assertEquals(0, broadcaster.connectedClients());
            assertEquals(0, broadcaster.pendingEvents("c1"));
        }

        @Test
        @DisplayName("a newer subscription replaces the old one without a disconnect")
        void resubscribeReplaces() {
            StreamBroadcaster broadcaster = new StreamBroadcaster(16, clock);
            List<String> disconnected = new CopyOnWriteArrayList<>();
            broadcaster.onDisconnect(disconnected::add);
            List<StreamEvent> first = new CopyOnWriteArrayList<>();
            List<Boolean> firstCompleted = new CopyOnWriteArrayList<>();
            broadcaster.subscribe("c1").subscribe(first::add, e -> {}, () -> firstCompleted.add(true));

            StepVerifier.create(broadcaster.subscribe("c1"))
                .assertNext(e -> assertEquals(StreamEventType.CONNECTED, e.type()))
                .then(() -> broadcaster.publish(log("c1", "after")))
                .assertNext(e -> assertEquals("after", messageOf(e)))
                .thenCancel()
                .verify();

            assertEquals(List.of(true), firstCompleted);
            assertEquals(1, first.size());
            assertEquals(List.of("c1"), disconnected);
        }

        @Test
        @DisplayName("a detached channel can be released")
        void releaseDetached() {
            StreamBroadcaster broadcaster = new StreamBroadcaster(16, clock);
            broadcaster.publish(log("c1", "pending"));
            broadcaster.releaseIfDetached("c1");
            assertEquals(0, broadcaster.pendingEvents("c1"));
        }
    }
}
