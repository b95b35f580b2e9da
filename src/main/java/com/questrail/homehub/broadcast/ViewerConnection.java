package com.questrail.homehub.broadcast;

import com.questrail.homehub.message.EncodedViewerMessage;

import java.time.Instant;
import java.util.concurrent.CompletionStage;

/**
 * One live viewer, independent of the WebSocket library that carries it.
 *
 * <p>Identity is reference identity: the hub keeps connections in a set and
 * implementations must not override {@code equals}.</p>
 */
public interface ViewerConnection
{
    /** Remote address or other label used in logs. */
    String remoteIdentity();

    Instant connectedAt();

    /**
     * Queue a message for delivery.
     *
     * <p>Must not block. The returned stage completes normally once the
     * message is written and exceptionally if the write fails. A synchronous
     * throw is treated the same as a failed stage.</p>
     */
    CompletionStage<Void> send(EncodedViewerMessage message);

    /**
     * Close the connection with a WebSocket close code and reason.
     * Closing an already closed connection is a no-op.
     */
    void close(int code, String reason);
}
