package com.questrail.homehub.transport;

/**
 * SensorTransport
 * -----------------------------------------------------------------------------
 * Minimal port for the publish/subscribe connection that delivers sensor
 * telemetry.
 *
 * <p>Higher layers are responsible for:</p>
 * <ul>
 *   <li>parsing topics and validating payloads</li>
 *   <li>updating live state and handing events to the event loop</li>
 * </ul>
 *
 * <p>Implementations may be backed by Paho MQTT or a test double.</p>
 */
public interface SensorTransport
{
    /**
     * Register the listener that receives inbound messages and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(SensorTransportListener listener);

    /**
     * Connect to the broker and subscribe to the sensor topics.
     *
     * <p>Blocks until the first connection attempt has completed. After a
     * successful start the implementation reconnects on its own and
     * re-subscribes on every reconnect.</p>
     *
     * @throws SensorTransportException if the first connection attempt fails
     */
    void start() throws SensorTransportException;

    /**
     * Disconnect and release all transport resources.
     *
     * <p>The listener receives {@link SensorTransportListener#onTransportDown(Throwable)}
     * with a {@code null} cause. Calling stop on a transport that never
     * started is a no-op.</p>
     */
    void stop();

    /**
     * Whether the broker connection is currently up.
     */
    boolean isConnected();

    /**
     * Human readable broker address, for logs.
     */
    String brokerDescription();
}
