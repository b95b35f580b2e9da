package com.questrail.homehub.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.homehub.api.Reading;
import com.questrail.homehub.api.SensorStatus;

import java.util.List;
import java.util.Map;

/**
 * JSON field layouts shared by several viewer messages. The field names are
 * what the dashboard reads; do not rename them.
 */
final class JsonShapes {

    private JsonShapes() {
    }

    static ObjectNode envelope(ObjectMapper mapper, ViewerMessageType type, JsonNode data) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", type.wireName());
        root.set("data", data);
        return root;
    }

    static ObjectNode reading(ObjectMapper mapper, Reading reading) {
        ObjectNode node = mapper.createObjectNode();
        node.put("sensor", reading.sensorId());
        node.put("prop", reading.property().wireName());
        node.put("temp", reading.value());
        node.put("ts", reading.observedAt().toString());
        return node;
    }

    static ArrayNode readings(ObjectMapper mapper, List<Reading> readings) {
        ArrayNode array = mapper.createArrayNode();
        for (Reading reading : readings) {
            array.add(reading(mapper, reading));
        }
        return array;
    }

    static ObjectNode status(ObjectMapper mapper, SensorStatus status) {
        ObjectNode node = mapper.createObjectNode();
        node.put("online", status.online());
        node.put("last_seen", status.lastSeen().toEpochMilli() / 1000.0);
        node.put("seconds_ago", Math.round(status.secondsSinceSeen() * 10.0) / 10.0);
        return node;
    }

    static ObjectNode statuses(ObjectMapper mapper, Map<String, SensorStatus> statuses) {
        ObjectNode node = mapper.createObjectNode();
        statuses.forEach((sensorId, status) -> node.set(sensorId, status(mapper, status)));
        return node;
    }
}
