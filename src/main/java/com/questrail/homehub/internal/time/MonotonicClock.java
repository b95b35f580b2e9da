package com.questrail.homehub.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every liveness and rate decision in the hub.
 *
 * <h2>Binding invariant</h2>
 * Offline detection, persistence throttling and sweep cadence MUST be computed
 * from this clock. Wall-clock time ({@link WallClock}) only labels readings and
 * statuses for viewers; an NTP step on the hub must never flip a sensor offline
 * or unblock a throttled write.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Only differences between two values are meaningful.
     */
    long nowNanos();
}
