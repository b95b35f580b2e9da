package com.questrail.homehub.observability;

import java.time.Instant;

/**
 * Sensor broker connectivity changes.
 */
public sealed interface TransportObservabilityEvent
        permits TransportObservabilityEvent.TransportUp, TransportObservabilityEvent.TransportDown
{
    Instant timestamp();

    record TransportUp(Instant timestamp, String broker) implements TransportObservabilityEvent {
    }

    /**
     * @param cause diagnostic cause; {@code null} for an orderly disconnect
     */
    record TransportDown(Instant timestamp, String broker, Throwable cause) implements TransportObservabilityEvent {
    }
}
