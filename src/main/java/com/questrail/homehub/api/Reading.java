package com.questrail.homehub.api;

import java.time.Instant;
import java.util.Objects;

/**
 * Reading
 * -----------------------------------------------------------------------------
 * One accepted sensor measurement.
 *
 * <p>Instances are only created from validated input (or reloaded from the
 * reading store, which only ever received validated input). Being an immutable
 * record, a {@code Reading} published through the live cache can never be
 * observed half-written by another thread.</p>
 *
 * @param sensorId   sensor identifier, {@code [A-Za-z0-9_-]{1,50}}
 * @param property   measured quantity
 * @param value      measured value, inside {@code property}'s range
 * @param observedAt wall-clock time the hub accepted the reading
 */
public record Reading(String sensorId, SensorProperty property, double value, Instant observedAt)
{
    public Reading {
        Objects.requireNonNull(sensorId, "sensorId");
        Objects.requireNonNull(property, "property");
        Objects.requireNonNull(observedAt, "observedAt");
    }

    public SensorKey key()
    {
        return new SensorKey(sensorId, property);
    }
}
