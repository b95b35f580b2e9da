package com.questrail.homehub.transport;

/**
 * SensorTransportListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link SensorTransport}.
 *
 * <p>Callbacks arrive on the transport's own thread (for Paho, the MQTT
 * callback thread). Implementations must not block and must not throw:
 * an exception escaping {@link #onMessage} would tear down the client
 * connection.</p>
 */
public interface SensorTransportListener
{
    /**
     * Called when the broker connection is established or re-established.
     */
    void onTransportUp();

    /**
     * Called when the broker connection is lost or closed.
     *
     * @param cause diagnostic cause; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called for every message received on a subscribed topic.
     *
     * <p>The payload is delivered exactly as received.</p>
     *
     * @param topic   topic the message was published to
     * @param payload raw message payload
     */
    void onMessage(String topic, byte[] payload);
}
