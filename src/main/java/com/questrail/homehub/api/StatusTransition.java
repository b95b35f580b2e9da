package com.questrail.homehub.api;

import java.time.Instant;
import java.util.Objects;

/**
 * A sensor flipping between online and offline.
 *
 * <p>Online transitions are reported synchronously when a reading arrives;
 * offline transitions are found by the periodic sweep. Each continuous
 * presence or absence produces exactly one transition.</p>
 */
public record StatusTransition(String sensorId, boolean online, Instant at)
{
    public StatusTransition {
        Objects.requireNonNull(sensorId, "sensorId");
        Objects.requireNonNull(at, "at");
    }
}
