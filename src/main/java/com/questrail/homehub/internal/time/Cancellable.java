package com.questrail.homehub.internal.time;

/**
 * Cancellation handle for a task armed on a {@link MonotonicScheduler}.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task. A task that is already running is
     * not interrupted.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
