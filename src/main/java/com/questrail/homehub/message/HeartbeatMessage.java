package com.questrail.homehub.message;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * {@code {"type":"heartbeat"}}
 */
public record HeartbeatMessage() implements ViewerMessage {

    public static final HeartbeatMessage INSTANCE = new HeartbeatMessage();

    @Override
    public ViewerMessageType type() {
        return ViewerMessageType.HEARTBEAT;
    }

    @Override
    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", type().wireName());
        return root;
    }
}
