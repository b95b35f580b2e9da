package com.questrail.homehub.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Update of one external data feed, e.g.
 * {@code {"type":"weather","data":{...}}}. The payload is opaque to the hub.
 */
public record FeedMessage(ViewerMessageType type, JsonNode data) implements ViewerMessage {

    public FeedMessage {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(data, "data");
        if (!type.isFeed()) {
            throw new IllegalArgumentException(type + " is not an external feed type");
        }
    }

    @Override
    public ObjectNode toJson(ObjectMapper mapper) {
        return JsonShapes.envelope(mapper, type, data);
    }
}
