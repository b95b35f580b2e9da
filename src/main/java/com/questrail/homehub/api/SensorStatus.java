package com.questrail.homehub.api;

import java.time.Instant;
import java.util.Objects;

/**
 * Derived liveness of a sensor at the moment it was computed.
 *
 * <p>Never stored: recomputed from the last time the sensor was seen and the
 * configured offline timeout.</p>
 *
 * @param sensorId         sensor identifier
 * @param online           whether the sensor reported within the offline timeout
 * @param lastSeen         wall-clock time of the last accepted reading
 * @param secondsSinceSeen elapsed seconds since that reading
 */
public record SensorStatus(String sensorId, boolean online, Instant lastSeen, double secondsSinceSeen)
{
    public SensorStatus {
        Objects.requireNonNull(sensorId, "sensorId");
        Objects.requireNonNull(lastSeen, "lastSeen");
    }
}
