package com.questrail.homehub.observability;

import java.time.Instant;

/**
 * Viewer connection lifecycle as seen by the broadcast hub.
 */
public sealed interface ViewerObservabilityEvent
        permits ViewerObservabilityEvent.Connected,
                ViewerObservabilityEvent.Rejected,
                ViewerObservabilityEvent.Disconnected,
                ViewerObservabilityEvent.DeliveryFailed
{
    Instant timestamp();

    String remoteIdentity();

    record Connected(Instant timestamp, String remoteIdentity, int active, int max)
            implements ViewerObservabilityEvent {
    }

    record Rejected(Instant timestamp, String remoteIdentity, String reason, int max)
            implements ViewerObservabilityEvent {
    }

    record Disconnected(Instant timestamp, String remoteIdentity, int active, int max)
            implements ViewerObservabilityEvent {
    }

    record DeliveryFailed(Instant timestamp, String remoteIdentity, Throwable cause)
            implements ViewerObservabilityEvent {
    }
}
