package com.questrail.homehub.internal.exec;

import com.questrail.homehub.broadcast.BroadcastHub;
import com.questrail.homehub.internal.events.HubEvent;
import com.questrail.homehub.internal.events.HubEventHandler;
import com.questrail.homehub.internal.time.WallClock;
import com.questrail.homehub.message.SensorStatusMessage;
import com.questrail.homehub.message.SensorsMessage;
import com.questrail.homehub.observability.HubErrorEvent;
import com.questrail.homehub.observability.HubObservabilitySink;
import com.questrail.homehub.state.LiveReadingCache;
import com.questrail.homehub.state.SensorStatusTracker;

import java.util.Objects;

/**
 * HubEventDispatcher
 * =============================================================================
 * Turns each {@link HubEvent} into exactly one broadcast. Runs on the event
 * loop.
 *
 * <ul>
 *   <li>{@code Telemetry}: all cached readings as a {@code sensors} message.</li>
 *   <li>{@code StatusChange}: every sensor's status as a {@code sensor_status}
 *       message.</li>
 * </ul>
 *
 * <p>Both messages carry full snapshots, so a viewer that missed one update
 * is corrected by the next. A failure while handling one event is reported
 * and does not affect later events.</p>
 */
public final class HubEventDispatcher implements HubEventHandler
{
    private final LiveReadingCache cache;
    private final SensorStatusTracker tracker;
    private final BroadcastHub hub;
    private final HubObservabilitySink sink;
    private final WallClock wallClock;

    public HubEventDispatcher(LiveReadingCache cache,
                              SensorStatusTracker tracker,
                              BroadcastHub hub,
                              HubObservabilitySink sink,
                              WallClock wallClock)
    {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.hub = Objects.requireNonNull(hub, "hub");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void handle(HubEvent event)
    {
        Objects.requireNonNull(event, "event");
        try {
            if (event instanceof HubEvent.Telemetry) {
                hub.broadcast(new SensorsMessage(cache.getAll()));
            } else if (event instanceof HubEvent.StatusChange) {
                hub.broadcast(new SensorStatusMessage(tracker.allStatuses()));
            }
        } catch (RuntimeException e) {
            sink.onError(new HubErrorEvent(wallClock.now(), "Failed to broadcast " + describe(event), e));
        }
    }

    private static String describe(HubEvent event)
    {
        if (event instanceof HubEvent.Telemetry t) {
            return "telemetry from " + t.reading().sensorId();
        }
        HubEvent.StatusChange s = (HubEvent.StatusChange) event;
        return "status change of " + s.sensorId() + (s.online() ? " (online)" : " (offline)");
    }
}
