package com.questrail.homehub.internal.events;

import com.questrail.homehub.api.Reading;

import java.time.Instant;
import java.util.Objects;

/**
 * HubEvent
 * -----------------------------------------------------------------------------
 * A state change produced on the MQTT callback thread that must reach viewers.
 *
 * <h2>Role in the architecture</h2>
 * Cache, status and throttle bookkeeping happen on the callback thread when a
 * reading is accepted. What crosses into the event loop is only the fact that
 * something changed, as a {@code HubEvent}, either directly through the
 * scheduler handoff or, before the scheduler is ready, through the startup
 * buffer. The event loop turns each event into exactly one broadcast.
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>Events are immutable</li>
 *   <li>Events are consumed exactly once</li>
 * </ul>
 */
public sealed interface HubEvent permits HubEvent.Telemetry, HubEvent.StatusChange
{
    /**
     * Wall-clock time the event was created.
     */
    Instant timestamp();

    /** An accepted reading; the live cache already holds it. */
    record Telemetry(Reading reading, Instant timestamp) implements HubEvent {
        public Telemetry {
            Objects.requireNonNull(reading, "reading");
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /** A sensor went online or offline; the status tracker already reflects it. */
    record StatusChange(String sensorId, boolean online, Instant timestamp) implements HubEvent {
        public StatusChange {
            Objects.requireNonNull(sensorId, "sensorId");
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }
}
