package com.questrail.homehub.transport;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * FakeSensorTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link SensorTransport}. Contains no MQTT behavior; tests inject
 * inbound messages directly.
 */
public final class FakeSensorTransport implements SensorTransport {

    private volatile SensorTransportListener listener;
    private volatile boolean connected;
    private volatile SensorTransportException startFailure;
    private volatile Runnable stopHook = () -> { };
    private int startCount;
    private int stopCount;

    @Override
    public void setListener(SensorTransportListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized void start() throws SensorTransportException {
        startCount++;
        if (startFailure != null) {
            throw startFailure;
        }
        connected = true;
        if (listener != null) {
            listener.onTransportUp();
        }
    }

    @Override
    public synchronized void stop() {
        stopCount++;
        stopHook.run();
        if (connected) {
            connected = false;
            if (listener != null) {
                listener.onTransportDown(null);
            }
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public String brokerDescription() {
        return "fake-broker:1883";
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void failStartWith(SensorTransportException failure) {
        this.startFailure = failure;
    }

    /** Runs at the start of every {@link #stop()} call. */
    public void onStop(Runnable hook) {
        this.stopHook = Objects.requireNonNull(hook, "hook");
    }

    public void inject(String topic, String payload) {
        inject(topic, payload.getBytes(StandardCharsets.US_ASCII));
    }

    public void inject(String topic, byte[] payload) {
        SensorTransportListener l = listener;
        if (l == null) {
            throw new IllegalStateException("No listener installed");
        }
        l.onMessage(topic, payload);
    }

    public void dropConnection(Throwable cause) {
        connected = false;
        SensorTransportListener l = listener;
        if (l != null) {
            l.onTransportDown(cause);
        }
    }

    public synchronized int startCount() {
        return startCount;
    }

    public synchronized int stopCount() {
        return stopCount;
    }
}
