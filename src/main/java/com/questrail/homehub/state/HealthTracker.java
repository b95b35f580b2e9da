package com.questrail.homehub.state;

import com.questrail.homehub.message.HubHealth;

/**
 * Connectivity flags shown in the {@code health} section of the initial
 * viewer state.
 *
 * <p>Written from the MQTT callback thread, read from the event loop. The hub
 * has no separate network check, so {@code wifi} mirrors broker
 * connectivity.</p>
 */
public final class HealthTracker {

    private volatile boolean brokerConnected;
    private volatile boolean databaseHealthy = true;

    public void brokerConnected(boolean connected) {
        this.brokerConnected = connected;
    }

    /** Record the outcome of the latest persistence attempt. */
    public void databaseHealthy(boolean healthy) {
        this.databaseHealthy = healthy;
    }

    public boolean isBrokerConnected() {
        return brokerConnected;
    }

    public boolean isDatabaseHealthy() {
        return databaseHealthy;
    }

    public HubHealth snapshot() {
        boolean broker = brokerConnected;
        return new HubHealth(broker, databaseHealthy, broker);
    }
}
