package com.stockinsight.orchestrator.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans {@link StreamEvent}s out to connected clients, one {@link ClientChannel} per client id.
 *
 * <p>Events published before a client subscribes wait in its channel. A subscription that
 * ends by cancellation counts as a disconnect: the channel is discarded and every
 * registered disconnect listener is told the client id. A subscription replaced by a newer
 * one for the same client completes without triggering a disconnect.
 */
public class StreamBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(StreamBroadcaster.class);

    private final Map<String, ClientChannel> channels = new ConcurrentHashMap<>();
    private final List<Consumer<String>> disconnectListeners = new CopyOnWriteArrayList<>();
    private final int queueCapacity;
    private final Clock clock;

    public StreamBroadcaster(int queueCapacity, Clock clock) {
        if (queueCapacity < 1) throw new IllegalArgumentException("queueCapacity must be positive");
        this.queueCapacity = queueCapacity;
        this.clock = clock;
    }

    public void publish(StreamEvent event) {
        ClientChannel channel = channels.computeIfAbsent(event.clientId(), this::newChannel);
        if (channel.offer(event)) {
            log.warn("[StreamBroadcaster] EVENT_DROPPED clientId={} dropped={} capacity={}",
                event.clientId(), channel.droppedCount(), queueCapacity);
        }
    }

    /**
     * Infinite stream of the client's events, starting with a {@code connected} event.
     * Cancelling the returned flux disconnects the client.
     */
    public Flux<StreamEvent> subscribe(String clientId) {
        return Flux.create(sink -> {
            ClientChannel channel = channels.computeIfAbsent(clientId, this::newChannel);
            channel.attach(sink, StreamEvent.connected(clientId, clock.instant()));
            sink.onRequest(n -> channel.drain());
            sink.onCancel(() -> disconnect(clientId, channel, sink));
            sink.onDispose(() -> channel.detach(sink));
            log.info("[StreamBroadcaster] CLIENT_CONNECTED clientId={} backlog={}", clientId, channel.size() - 1);
        });
    }

    public void onDisconnect(Consumer<String> listener) {
        disconnectListeners.add(listener);
    }

    /** Discards a channel nobody is subscribed to, e.g. once its client has no tasks left. */
    public void releaseIfDetached(String clientId) {
        channels.computeIfPresent(clientId, (id, channel) -> channel.isAttached() ? channel : null);
    }

    public int connectedClients() {
        return (int) channels.values().stream().filter(ClientChannel::isAttached).count();
    }

    public int pendingEvents(String clientId) {
        ClientChannel channel = channels.get(clientId);
        return channel == null ? 0 : channel.size();
    }

    public long droppedEvents(String clientId) {
        ClientChannel channel = channels.get(clientId);
        return channel == null ? 0 : channel.droppedCount();
    }

    private ClientChannel newChannel(String clientId) {
        return new ClientChannel(clientId, queueCapacity);
    }

    private void disconnect(String clientId, ClientChannel channel, FluxSink<StreamEvent> sink) {
        if (!channel.detach(sink)) return;
        channels.remove(clientId, channel);
        log.info("[StreamBroadcaster] CLIENT_DISCONNECTED clientId={} undelivered={}", clientId, channel.size());
        for (Consumer<String> listener : disconnectListeners) {
            try {
                listener.accept(clientId);
            } catch (RuntimeException e) {
                log.error("[StreamBroadcaster] Disconnect listener failed clientId={} reason={}",
                    clientId, e.getMessage(), e);
            }
        }
    }
}
