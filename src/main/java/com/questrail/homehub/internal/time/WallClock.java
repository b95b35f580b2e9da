package com.questrail.homehub.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used to timestamp readings ({@code ts}) and statuses
 * ({@code last_seen}) shown to viewers. Never used for timeouts.
 */
public interface WallClock
{
    Instant now();
}
