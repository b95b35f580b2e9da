package com.questrail.homehub.message;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A viewer message serialized once, ready to be written to any number of
 * connections.
 *
 * <p>The UTF-8 bytes are computed at construction and shared by every
 * connection the message is sent to. Callers must not modify the array
 * returned by {@link #utf8()}.</p>
 */
public final class EncodedViewerMessage {

    private final ViewerMessageType type;
    private final String text;
    private final byte[] utf8;

    public EncodedViewerMessage(ViewerMessageType type, String text) {
        this.type = Objects.requireNonNull(type, "type");
        this.text = Objects.requireNonNull(text, "text");
        this.utf8 = text.getBytes(StandardCharsets.UTF_8);
    }

    public ViewerMessageType type() {
        return type;
    }

    public String text() {
        return text;
    }

    public byte[] utf8() {
        return utf8;
    }

    @Override
    public String toString() {
        return "EncodedViewerMessage[" + type.wireName() + ", " + utf8.length + " bytes]";
    }
}
