package com.questrail.homehub.message;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * ViewerMessage
 * -----------------------------------------------------------------------------
 * Closed family of messages the hub sends to dashboard viewers.
 *
 * <p>Each variant knows its own JSON shape. The common envelope is
 * {@code {"type": ..., "data": ...}}; {@link InitialStateMessage} is flattened
 * and {@link HeartbeatMessage} has no {@code data}.</p>
 */
public sealed interface ViewerMessage
        permits InitialStateMessage, SensorsMessage, SensorStatusMessage, FeedMessage, HeartbeatMessage
{
    ViewerMessageType type();

    /**
     * Build the JSON tree for this message.
     */
    ObjectNode toJson(ObjectMapper mapper);
}
