package com.questrail.homehub.message;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.homehub.api.Reading;

import java.util.List;
import java.util.Objects;

/**
 * {@code {"type":"sensors","data":[{"sensor","prop","temp","ts"}, ...]}}
 */
public record SensorsMessage(List<Reading> readings) implements ViewerMessage {

    public SensorsMessage {
        readings = List.copyOf(Objects.requireNonNull(readings, "readings"));
    }

    @Override
    public ViewerMessageType type() {
        return ViewerMessageType.SENSORS;
    }

    @Override
    public ObjectNode toJson(ObjectMapper mapper) {
        return JsonShapes.envelope(mapper, type(), JsonShapes.readings(mapper, readings));
    }
}
