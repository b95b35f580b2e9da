package com.questrail.homehub.api;

import java.util.Objects;

/**
 * Identity of one measurement stream: a sensor and the property it reports.
 * Keys the live cache and the persistence throttle.
 */
public record SensorKey(String sensorId, SensorProperty property)
{
    public SensorKey {
        Objects.requireNonNull(sensorId, "sensorId");
        Objects.requireNonNull(property, "property");
    }
}
