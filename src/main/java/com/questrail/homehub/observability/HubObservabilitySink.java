package com.questrail.homehub.observability;

import com.questrail.homehub.api.StatusTransition;

/**
 * Receives everything worth knowing about the hub at runtime.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Methods are called from both the MQTT callback thread and the event loop;
 * implementations must be thread-safe and must not block.</p>
 */
public interface HubObservabilitySink {
    /**
     * A sensor went online or offline.
     */
    void onStatusTransition(StatusTransition transition);

    /**
     * Input was dropped on the ingestion path.
     */
    void onIngestEvent(IngestObservabilityEvent event);

    /**
     * A viewer connected, was turned away, left, or failed a delivery.
     */
    void onViewerEvent(ViewerObservabilityEvent event);

    /**
     * The sensor broker connection changed state.
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * A unit of work failed; the hub carries on.
     */
    void onError(HubErrorEvent event);
}
