package com.questrail.homehub.state;

import com.questrail.homehub.api.SensorKey;
import com.questrail.homehub.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * PersistenceThrottle
 * -----------------------------------------------------------------------------
 * Limits durable writes to one per {@link SensorKey} per window.
 *
 * <p>Sensors publish every few seconds; storing each sample would wear out the
 * storage medium for no gain. The throttle only gates the reading store. The
 * live cache and viewer broadcasts always take every accepted reading.</p>
 *
 * <p>{@link #shouldPersist(SensorKey)} checks and records under one lock, so two
 * concurrent callers can never both be granted the same key within a window.</p>
 */
public final class PersistenceThrottle {

    private final MonotonicClock clock;
    private final long windowNanos;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<SensorKey, Long> lastPersistedNanos = new HashMap<>();

    public PersistenceThrottle(MonotonicClock clock, Duration window) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(window, "window");
        if (window.isNegative()) {
            throw new IllegalArgumentException("window must be non-negative");
        }
        this.windowNanos = window.toNanos();
    }

    /**
     * Decide whether a reading for {@code key} should be written now. A
     * {@code true} answer is recorded as the key's new last-persisted time.
     */
    public boolean shouldPersist(SensorKey key) {
        Objects.requireNonNull(key, "key");
        long nowNanos = clock.nowNanos();

        lock.lock();
        try {
            Long last = lastPersistedNanos.get(key);
            if (last != null && nowNanos - last < windowNanos) {
                return false;
            }
            lastPersistedNanos.put(key, nowNanos);
            return true;
        } finally {
            lock.unlock();
        }
    }
}
