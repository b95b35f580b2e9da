package com.questrail.homehub.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.homehub.message.ViewerMessageType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Latest payload of each external data feed (weather, transit, nameday,
 * host stats, task list, calendar).
 *
 * <p>The pollers that fetch those feeds live outside the hub core; they hand
 * each fetch result to {@link #update}, which reports whether anything changed
 * so unchanged fetches are not re-broadcast. The board also supplies the feed
 * sections of the initial state sent to a new viewer.</p>
 *
 * <p>Accessed only from the event loop, but synchronized so tests and startup
 * code may read it from elsewhere.</p>
 */
public final class ExternalFeedBoard {

    private final Map<ViewerMessageType, JsonNode> latest = new EnumMap<>(ViewerMessageType.class);

    /**
     * Store {@code payload} as the latest value of {@code feed}.
     *
     * @return {@code true} if the payload differs from the previous one
     */
    public synchronized boolean update(ViewerMessageType feed, JsonNode payload) {
        requireFeed(feed);
        Objects.requireNonNull(payload, "payload");
        JsonNode previous = latest.put(feed, payload.deepCopy());
        return !payload.equals(previous);
    }

    public synchronized Optional<JsonNode> latest(ViewerMessageType feed) {
        requireFeed(feed);
        JsonNode node = latest.get(feed);
        return node == null ? Optional.empty() : Optional.of(node.deepCopy());
    }

    public synchronized Map<ViewerMessageType, JsonNode> snapshot() {
        Map<ViewerMessageType, JsonNode> copy = new EnumMap<>(ViewerMessageType.class);
        latest.forEach((feed, node) -> copy.put(feed, node.deepCopy()));
        return Collections.unmodifiableMap(copy);
    }

    private static void requireFeed(ViewerMessageType feed) {
        Objects.requireNonNull(feed, "feed");
        if (!feed.isFeed()) {
            throw new IllegalArgumentException(feed + " is not an external feed type");
        }
    }
}
