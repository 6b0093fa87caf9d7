package com.stockinsight.orchestrator.stream;

import reactor.core.publisher.FluxSink;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded, ordered outgoing queue of one client.
 *
 * <p>Events are handed to the attached sink only as far as downstream demand allows; the
 * rest wait in the queue. When the queue is full the oldest non-terminal event is dropped
 * to make room. Terminal events are never dropped, so the queue may briefly exceed its
 * capacity when it holds nothing else.
 */
final class ClientChannel {

    private final String clientId;
    private final int capacity;
    private final Object lock = new Object();
    private final Deque<StreamEvent> queue = new ArrayDeque<>();
    private final AtomicInteger wip = new AtomicInteger();

    private FluxSink<StreamEvent> sink;
    private long dropped;

    ClientChannel(String clientId, int capacity) {
        this.clientId = clientId;
        this.capacity = capacity;
    }

    String clientId() {
        return clientId;
    }

    /**
     * Appends {@code event}.
     *
     * @return {@code true} if an older event had to be dropped to make room
     */
    boolean offer(StreamEvent event) {
        boolean droppedOne = false;
        synchronized (lock) {
            if (queue.size() >= capacity) {
                droppedOne = dropOldestNonTerminal();
            }
            queue.addLast(event);
        }
        drain();
        return droppedOne;
    }

    /**
     * Binds a new downstream subscriber, completing the previous one. {@code greeting}
     * is delivered before anything already queued.
     */
    void attach(FluxSink<StreamEvent> newSink, StreamEvent greeting) {
        FluxSink<StreamEvent> previous;
        synchronized (lock) {
            previous = sink;
            sink = newSink;
            queue.addFirst(greeting);
        }
        if (previous != null) previous.complete();
        drain();
    }

    /** Unbinds {@code oldSink} if it is still the current subscriber. */
    boolean detach(FluxSink<StreamEvent> oldSink) {
        synchronized (lock) {
            if (sink != oldSink) return false;
            sink = null;
            return true;
        }
    }

    boolean isAttached() {
        synchronized (lock) {
            return sink != null;
        }
    }

    int size() {
        synchronized (lock) {
            return queue.size();
        }
    }

    long droppedCount() {
        synchronized (lock) {
            return dropped;
        }
    }

    /** Single-drainer loop; concurrent callers only mark that another pass is needed. */
    void drain() {
        if (wip.getAndIncrement() != 0) return;
        int missed = 1;
        do {
            while (true) {
                FluxSink<StreamEvent> target;
                StreamEvent next;
                synchronized (lock) {
                    target = sink;
                    if (target == null || target.requestedFromDownstream() <= 0 || queue.isEmpty()) break;
                    next = queue.pollFirst();
                }
                target.next(next);
            }
            missed = wip.addAndGet(-missed);
        } while (missed != 0);
    }

    private boolean dropOldestNonTerminal() {
        Iterator<StreamEvent> it = queue.iterator();
        while (it.hasNext()) {
            if (!it.next().type().isTerminal()) {
                it.remove();
                dropped++;
                return true;
            }
        }
        return false;
    }
}
