package com.questrail.homehub.observability;

import com.questrail.homehub.api.StatusTransition;

/**
 * No-op implementation of HubObservabilitySink.
 */
public final class NullObservabilitySink implements HubObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStatusTransition(StatusTransition transition) {}

    @Override
    public void onIngestEvent(IngestObservabilityEvent event) {}

    @Override
    public void onViewerEvent(ViewerObservabilityEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(HubErrorEvent event) {}
}
