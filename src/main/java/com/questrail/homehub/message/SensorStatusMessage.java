package com.questrail.homehub.message;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.homehub.api.SensorStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code {"type":"sensor_status","data":{"<sensor>":{"online","last_seen","seconds_ago"}}}}
 *
 * <p>Always carries every known sensor; the dashboard replaces its whole
 * status table with {@code data}.</p>
 */
public record SensorStatusMessage(Map<String, SensorStatus> statuses) implements ViewerMessage {

    public SensorStatusMessage {
        statuses = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(statuses, "statuses")));
    }

    @Override
    public ViewerMessageType type() {
        return ViewerMessageType.SENSOR_STATUS;
    }

    @Override
    public ObjectNode toJson(ObjectMapper mapper) {
        return JsonShapes.envelope(mapper, type(), JsonShapes.statuses(mapper, statuses));
    }
}
