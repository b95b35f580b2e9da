package com.questrail.homehub.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.homehub.api.Reading;
import com.questrail.homehub.api.SensorStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * InitialStateMessage
 * -----------------------------------------------------------------------------
 * Everything a freshly connected viewer needs to render the dashboard.
 *
 * <p>Unlike every other message this one is flattened: the sections sit next to
 * {@code type} instead of under {@code data}. Feeds that have not delivered yet
 * are {@code null}.</p>
 */
public record InitialStateMessage(
        List<Reading> sensors,
        Map<String, SensorStatus> sensorStatus,
        Map<ViewerMessageType, JsonNode> feeds,
        HubHealth health
) implements ViewerMessage {

    public InitialStateMessage {
        sensors = List.copyOf(Objects.requireNonNull(sensors, "sensors"));
        sensorStatus = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(sensorStatus, "sensorStatus")));
        Objects.requireNonNull(feeds, "feeds");
        Map<ViewerMessageType, JsonNode> feedCopy = new EnumMap<>(ViewerMessageType.class);
        feedCopy.putAll(feeds);
        feeds = Collections.unmodifiableMap(feedCopy);
        Objects.requireNonNull(health, "health");
    }

    @Override
    public ViewerMessageType type() {
        return ViewerMessageType.INITIAL;
    }

    @Override
    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", type().wireName());
        root.set("sensors", JsonShapes.readings(mapper, sensors));
        root.set("sensor_status", JsonShapes.statuses(mapper, sensorStatus));
        putFeed(root, ViewerMessageType.SYSTEM);
        putFeed(root, ViewerMessageType.WEATHER);
        putFeed(root, ViewerMessageType.NAMEDAY);

        ObjectNode healthNode = root.putObject("health");
        healthNode.put("mqtt", health.mqtt());
        healthNode.put("database", health.database());
        healthNode.put("wifi", health.wifi());

        putFeed(root, ViewerMessageType.TRANSPORT);
        putFeed(root, ViewerMessageType.TODOIST);
        putFeed(root, ViewerMessageType.CALENDAR);
        return root;
    }

    private void putFeed(ObjectNode root, ViewerMessageType feed) {
        JsonNode payload = feeds.get(feed);
        if (payload == null) {
            root.putNull(feed.wireName());
        } else {
            root.set(feed.wireName(), payload);
        }
    }
}
