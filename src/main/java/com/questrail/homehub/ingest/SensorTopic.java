package com.questrail.homehub.ingest;

import java.util.Objects;
import java.util.Optional;

/**
 * MQTT topic convention for sensor telemetry: {@code pico/{property}/{sensor}}.
 *
 * <p>Parsing is purely structural. Whether the property and sensor segments
 * are acceptable is decided by the validator.</p>
 */
public record SensorTopic(String property, String sensorId) {

    public static final String PREFIX = "pico";

    public SensorTopic {
        Objects.requireNonNull(property, "property");
        Objects.requireNonNull(sensorId, "sensorId");
    }

    /**
     * Split a topic into its property and sensor segments.
     *
     * @return empty unless the topic has exactly three segments and starts
     *         with {@value #PREFIX}; empty property or sensor segments are
     *         left for the validator to reject
     */
    public static Optional<SensorTopic> parse(String topic) {
        if (topic == null) {
            return Optional.empty();
        }
        String[] parts = topic.split("/", -1);
        if (parts.length != 3 || !PREFIX.equals(parts[0])) {
            return Optional.empty();
        }
        return Optional.of(new SensorTopic(parts[1], parts[2]));
    }

    public String toTopic() {
        return PREFIX + "/" + property + "/" + sensorId;
    }
}
