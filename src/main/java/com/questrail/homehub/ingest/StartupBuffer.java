package com.questrail.homehub.ingest;

import com.questrail.homehub.internal.events.HubEvent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * StartupBuffer
 * -----------------------------------------------------------------------------
 * Bounded FIFO holding events produced before the scheduler is ready.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #offer(List)} never blocks. A group of events is accepted
 *       whole or not at all; when it does not fit, the incoming (newest) group
 *       is refused and the caller drops it.</li>
 *   <li>{@link #drain()} hands back everything in arrival order and can be
 *       called once. Afterwards the buffer refuses all offers.</li>
 * </ul>
 *
 * <p>Dropping the newest rather than the oldest event is a known lossy edge:
 * the buffer only fills if the broker delivers more than {@code capacity}
 * events before the viewer server is up.</p>
 */
public final class StartupBuffer {

    private final int capacity;
    private final Deque<HubEvent> events = new ArrayDeque<>();
    private boolean drained;

    public StartupBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Append a group of events produced by one message.
     *
     * @return {@code false} if the group did not fit or the buffer was drained
     */
    public synchronized boolean offer(List<HubEvent> group) {
        Objects.requireNonNull(group, "group");
        if (drained || events.size() + group.size() > capacity) {
            return false;
        }
        events.addAll(group);
        return true;
    }

    /**
     * Remove and return every buffered event, oldest first.
     *
     * @throws IllegalStateException on a second call
     */
    public synchronized List<HubEvent> drain() {
        if (drained) {
            throw new IllegalStateException("StartupBuffer already drained");
        }
        drained = true;
        List<HubEvent> all = List.copyOf(events);
        events.clear();
        return all;
    }

    public synchronized int size() {
        return events.size();
    }

    public int capacity() {
        return capacity;
    }
}
