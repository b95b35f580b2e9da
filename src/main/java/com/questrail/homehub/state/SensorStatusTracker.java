package com.questrail.homehub.state;

import com.questrail.homehub.api.SensorStatus;
import com.questrail.homehub.api.StatusTransition;
import com.questrail.homehub.internal.time.MonotonicClock;
import com.questrail.homehub.internal.time.WallClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SensorStatusTracker
 * =============================================================================
 * Owns the "last seen" bookkeeping for every sensor and derives online/offline
 * transitions from it.
 *
 * <h2>Transition rule</h2>
 * A sensor is online iff {@code now - lastSeen < offlineTimeout}.
 * <ul>
 *   <li>{@link #recordSeen(String)} reports the offline→online (or first-seen)
 *       transition synchronously, so a recovering sensor is announced in the
 *       same cycle that processes its reading.</li>
 *   <li>{@link #sweep()} reports only online→offline transitions, exactly
 *       once per continuous absence.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Called from the MQTT callback thread ({@code recordSeen}) and the event loop
 * ({@code sweep}, status snapshots). One lock guards the map and is held only
 * for the map access itself. Callers act on returned transitions after the
 * lock is released.
 *
 * <p>Liveness uses the {@link MonotonicClock}; the {@link WallClock} only
 * labels {@code lastSeen} for viewers.</p>
 */
public final class SensorStatusTracker {

    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final long offlineTimeoutNanos;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Presence> presenceBySensor = new HashMap<>();

    public SensorStatusTracker(MonotonicClock clock, WallClock wallClock, Duration offlineTimeout) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(offlineTimeout, "offlineTimeout");
        if (offlineTimeout.isNegative() || offlineTimeout.isZero()) {
            throw new IllegalArgumentException("offlineTimeout must be positive");
        }
        this.offlineTimeoutNanos = offlineTimeout.toNanos();
    }

    /**
     * Record that an accepted reading from {@code sensorId} arrived now.
     *
     * @return an online transition if the sensor was unknown or offline
     */
    public Optional<StatusTransition> recordSeen(String sensorId) {
        Objects.requireNonNull(sensorId, "sensorId");
        long nowNanos = clock.nowNanos();
        Instant wallNow = wallClock.now();

        boolean wasOnline;
        lock.lock();
        try {
            Presence presence = presenceBySensor.get(sensorId);
            wasOnline = presence != null && presence.online;
            presenceBySensor.put(sensorId, new Presence(nowNanos, wallNow, true));
        } finally {
            lock.unlock();
        }

        return wasOnline
                ? Optional.empty()
                : Optional.of(new StatusTransition(sensorId, true, wallNow));
    }

    /**
     * Flag every online sensor whose last reading is at least the offline
     * timeout old.
     *
     * @return the online→offline transitions found by this call, in sensor id order
     */
    public List<StatusTransition> sweep() {
        long nowNanos = clock.nowNanos();
        Instant wallNow = wallClock.now();

        List<String> expired = new ArrayList<>();
        lock.lock();
        try {
            for (Map.Entry<String, Presence> entry : presenceBySensor.entrySet()) {
                Presence presence = entry.getValue();
                if (presence.online && nowNanos - presence.lastSeenNanos >= offlineTimeoutNanos) {
                    entry.setValue(presence.markedOffline());
                    expired.add(entry.getKey());
                }
            }
        } finally {
            lock.unlock();
        }

        if (expired.isEmpty()) {
            return List.of();
        }
        Collections.sort(expired);
        List<StatusTransition> transitions = new ArrayList<>(expired.size());
        for (String sensorId : expired) {
            transitions.add(new StatusTransition(sensorId, false, wallNow));
        }
        return transitions;
    }

    /**
     * Status of one sensor as of now, or empty if it has never been seen.
     */
    public Optional<SensorStatus> computeStatus(String sensorId) {
        Objects.requireNonNull(sensorId, "sensorId");
        long nowNanos = clock.nowNanos();

        Presence presence;
        lock.lock();
        try {
            presence = presenceBySensor.get(sensorId);
        } finally {
            lock.unlock();
        }
        return presence == null ? Optional.empty() : Optional.of(derive(sensorId, presence, nowNanos));
    }

    /**
     * Statuses of all sensors ever seen, keyed and ordered by sensor id.
     */
    public Map<String, SensorStatus> allStatuses() {
        long nowNanos = clock.nowNanos();

        Map<String, Presence> copy;
        lock.lock();
        try {
            copy = new HashMap<>(presenceBySensor);
        } finally {
            lock.unlock();
        }

        Map<String, SensorStatus> statuses = new TreeMap<>();
        copy.forEach((sensorId, presence) -> statuses.put(sensorId, derive(sensorId, presence, nowNanos)));
        return Collections.unmodifiableMap(statuses);
    }

    private SensorStatus derive(String sensorId, Presence presence, long nowNanos) {
        long elapsed = Math.max(0, nowNanos - presence.lastSeenNanos);
        return new SensorStatus(
                sensorId,
                elapsed < offlineTimeoutNanos,
                presence.lastSeenWall,
                elapsed / 1_000_000_000.0);
    }

    // Immutable so the lock only ever guards map membership.
    private record Presence(long lastSeenNanos, Instant lastSeenWall, boolean online) {
        Presence markedOffline() {
            return new Presence(lastSeenNanos, lastSeenWall, false);
        }
    }
}
