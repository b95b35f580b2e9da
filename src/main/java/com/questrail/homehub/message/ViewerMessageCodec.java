package com.questrail.homehub.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Serializes {@link ViewerMessage}s to the JSON text sent over the viewer
 * WebSocket.
 *
 * <p>Thread-safe: {@link ObjectMapper} is safe for concurrent use once
 * configured.</p>
 */
public final class ViewerMessageCodec {

    private final ObjectMapper mapper;

    public ViewerMessageCodec() {
        this(new ObjectMapper());
    }

    public ViewerMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public EncodedViewerMessage encode(ViewerMessage message) {
        Objects.requireNonNull(message, "message");
        try {
            return new EncodedViewerMessage(message.type(), mapper.writeValueAsString(message.toJson(mapper)));
        } catch (JsonProcessingException e) {
            throw new MessageEncodingException("Failed to encode " + message.type().wireName() + " message", e);
        }
    }
}
