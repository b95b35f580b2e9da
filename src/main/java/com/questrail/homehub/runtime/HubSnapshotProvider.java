package com.questrail.homehub.runtime;

import com.questrail.homehub.message.InitialStateMessage;
import com.questrail.homehub.state.ExternalFeedBoard;
import com.questrail.homehub.state.HealthTracker;
import com.questrail.homehub.state.LiveReadingCache;
import com.questrail.homehub.state.SensorStatusTracker;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Builds the {@code initial} message for a newly admitted viewer from the
 * current cache, sensor statuses, feed board and health flags.
 */
public final class HubSnapshotProvider implements Supplier<InitialStateMessage> {

    private final LiveReadingCache cache;
    private final SensorStatusTracker tracker;
    private final ExternalFeedBoard feeds;
    private final HealthTracker health;

    public HubSnapshotProvider(LiveReadingCache cache,
                               SensorStatusTracker tracker,
                               ExternalFeedBoard feeds,
                               HealthTracker health) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.feeds = Objects.requireNonNull(feeds, "feeds");
        this.health = Objects.requireNonNull(health, "health");
    }

    @Override
    public InitialStateMessage get() {
        return new InitialStateMessage(cache.getAll(), tracker.allStatuses(), feeds.snapshot(), health.snapshot());
    }
}
