package com.questrail.homehub.observability;

import com.questrail.homehub.api.StatusTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of HubObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jHubObservabilitySink implements HubObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jHubObservabilitySink.class);

    @Override
    public void onStatusTransition(StatusTransition transition) {
        if (transition.online()) {
            log.info("Sensor {} online", transition.sensorId());
        } else {
            log.warn("Sensor {} offline", transition.sensorId());
        }
    }

    @Override
    public void onIngestEvent(IngestObservabilityEvent event) {
        if (event instanceof IngestObservabilityEvent.InputRejected rejected) {
            log.warn("Rejected message on {}: {} ({})", rejected.topic(), rejected.reason(), rejected.detail());
        } else if (event instanceof IngestObservabilityEvent.OverflowDropped dropped) {
            log.warn("Startup buffer full (capacity {}), dropped {} event(s)",
                dropped.capacity(), dropped.dropped().size());
        }
    }

    @Override
    public void onViewerEvent(ViewerObservabilityEvent event) {
        if (event instanceof ViewerObservabilityEvent.Connected connected) {
            log.info("Viewer connected: {} (total: {}/{})",
                connected.remoteIdentity(), connected.active(), connected.max());
        } else if (event instanceof ViewerObservabilityEvent.Rejected rejected) {
            log.warn("Viewer rejected: {} ({}, max {})",
                rejected.remoteIdentity(), rejected.reason(), rejected.max());
        } else if (event instanceof ViewerObservabilityEvent.Disconnected disconnected) {
            log.info("Viewer disconnected: {} (total: {}/{})",
                disconnected.remoteIdentity(), disconnected.active(), disconnected.max());
        } else if (event instanceof ViewerObservabilityEvent.DeliveryFailed failed) {
            log.warn("Failed to send to viewer {}: {}", failed.remoteIdentity(), String.valueOf(failed.cause()));
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event instanceof TransportObservabilityEvent.TransportUp up) {
            log.info("MQTT connected to {}", up.broker());
        } else if (event instanceof TransportObservabilityEvent.TransportDown down) {
            if (down.cause() == null) {
                log.info("MQTT disconnected from {}", down.broker());
            } else {
                log.warn("MQTT connection to {} lost", down.broker(), down.cause());
            }
        }
    }

    @Override
    public void onError(HubErrorEvent event) {
        log.error("Hub error: {}", event.message(), event.cause());
    }
}
