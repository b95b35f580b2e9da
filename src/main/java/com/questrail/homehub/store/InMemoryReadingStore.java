package com.questrail.homehub.store;

import com.questrail.homehub.api.Reading;
import com.questrail.homehub.api.SensorKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory implementation of {@link ReadingStore} for development and tests.
 * Keeps only the newest reading per sensor and property, so memory is bounded
 * by the number of keys however long the hub runs. Data is lost when the
 * process stops.
 */
public final class InMemoryReadingStore implements ReadingStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReadingStore.class);

    private final Map<SensorKey, Reading> latest = new LinkedHashMap<>();

    public InMemoryReadingStore() {
    }

    /**
     * Start with pre-existing rows, as if loaded from a previous run.
     */
    public InMemoryReadingStore(List<Reading> existing) {
        Objects.requireNonNull(existing, "existing").forEach(this::append);
    }

    @Override
    public synchronized void persist(Reading reading) {
        Objects.requireNonNull(reading, "reading");
        append(reading);
        log.debug("Stored {} [{}] = {}", reading.sensorId(), reading.property().wireName(), reading.value());
    }

    @Override
    public synchronized List<Reading> loadLatest() {
        return List.copyOf(latest.values());
    }

    /** Number of distinct sensor and property keys held. */
    public synchronized int size() {
        return latest.size();
    }

    private synchronized void append(Reading reading) {
        latest.put(reading.key(), reading);
    }
}
