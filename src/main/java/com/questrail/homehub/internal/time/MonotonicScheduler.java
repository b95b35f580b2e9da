package com.questrail.homehub.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * The hub's single cooperative run context.
 *
 * <p>Everything that touches viewer connections runs here: the startup replay,
 * telemetry and status broadcasts, the timeout sweep and feed publication.
 * Implementations MUST run tasks one at a time, and tasks passed to
 * {@link #execute(Runnable)} from one thread MUST run in the order they were
 * submitted.</p>
 *
 * <h2>Cross-thread handoff</h2>
 * {@link #execute(Runnable)} is the only primitive the MQTT callback thread
 * uses to reach this context. It must never block the caller.
 */
public interface MonotonicScheduler
{
    /**
     * Run the task on the scheduler context as soon as possible.
     * Safe to call from any thread.
     */
    void execute(Runnable task);

    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule after a duration, measured on the provided clock.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }
}
