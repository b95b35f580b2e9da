package com.questrail.homehub.store;

import com.questrail.homehub.api.Reading;

import java.util.List;

/**
 * ReadingStore
 * -----------------------------------------------------------------------------
 * Port to the durable reading store.
 *
 * <p>The storage engine (schema, retention, cleanup) lives outside the hub
 * core. The core only appends throttled readings and, once at startup, asks
 * for the latest reading per (sensor, property) to seed the live cache.</p>
 *
 * <p>{@link #persist(Reading)} is called from the MQTT callback thread and
 * should return promptly. Failures are reported by the caller and never
 * retried inline.</p>
 */
public interface ReadingStore {

    /**
     * Durably append one reading.
     *
     * @throws PersistenceException if the write did not happen
     */
    void persist(Reading reading) throws PersistenceException;

    /**
     * Latest stored reading for every (sensor, property) pair.
     *
     * @throws PersistenceException if the store cannot be read
     */
    List<Reading> loadLatest() throws PersistenceException;
}
