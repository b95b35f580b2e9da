package com.questrail.homehub.observability;

import com.questrail.homehub.internal.events.HubEvent;
import com.questrail.homehub.validation.RejectReason;

import java.time.Instant;
import java.util.List;

/**
 * Events from the MQTT ingestion path that drop input without failing.
 */
public sealed interface IngestObservabilityEvent
        permits IngestObservabilityEvent.InputRejected, IngestObservabilityEvent.OverflowDropped
{
    Instant timestamp();

    /** A message failed topic parsing or validation and was discarded. */
    record InputRejected(Instant timestamp, String topic, RejectReason reason, String detail)
            implements IngestObservabilityEvent {
    }

    /** The startup buffer was full; these events (the newest) were discarded. */
    record OverflowDropped(Instant timestamp, List<HubEvent> dropped, int capacity)
            implements IngestObservabilityEvent {
        public OverflowDropped {
            dropped = List.copyOf(dropped);
        }
    }
}
