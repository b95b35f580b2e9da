package com.questrail.homehub.state;

import com.questrail.homehub.api.Reading;
import com.questrail.homehub.api.SensorKey;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * LiveReadingCache
 * -----------------------------------------------------------------------------
 * Latest accepted {@link Reading} per {@link SensorKey}; the authoritative
 * state served to viewers.
 *
 * <p>Written by the MQTT callback thread, read by the event loop. Entries are
 * immutable records in a {@link ConcurrentHashMap}, so a snapshot never
 * contains a half-written reading. There is no eviction: the set of
 * (sensor, property) pairs in a home is small and grows slowly.</p>
 */
public final class LiveReadingCache {

    private final Map<SensorKey, Reading> latest = new ConcurrentHashMap<>();
    private final AtomicBoolean seeded = new AtomicBoolean(false);

    public void put(Reading reading) {
        Objects.requireNonNull(reading, "reading");
        latest.put(reading.key(), reading);
    }

    public Optional<Reading> get(SensorKey key) {
        return Optional.ofNullable(latest.get(Objects.requireNonNull(key, "key")));
    }

    /**
     * Immutable snapshot of every cached reading, in no particular order.
     */
    public List<Reading> getAll() {
        return List.copyOf(latest.values());
    }

    /**
     * Seed from the reading store at startup. Allowed once; a reading that
     * already arrived live is not overwritten by its stored predecessor.
     *
     * @throws IllegalStateException if the cache was already seeded
     */
    public void loadInitial(List<Reading> seed) {
        Objects.requireNonNull(seed, "seed");
        if (!seeded.compareAndSet(false, true)) {
            throw new IllegalStateException("LiveReadingCache already seeded");
        }
        for (Reading reading : seed) {
            latest.putIfAbsent(reading.key(), reading);
        }
    }

    public int size() {
        return latest.size();
    }

    public boolean isEmpty() {
        return latest.isEmpty();
    }
}
