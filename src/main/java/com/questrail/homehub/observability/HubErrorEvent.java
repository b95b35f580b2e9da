package com.questrail.homehub.observability;

import java.time.Instant;

/**
 * A failure isolated to one unit of work (a store write, an event handler).
 */
public record HubErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
