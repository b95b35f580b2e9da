package com.questrail.homehub.internal.events;

/**
 * Consumer of {@link HubEvent}s on the scheduler context.
 *
 * <p>Live events and replayed startup events arrive through the same handler.
 * Implementations run on the event loop and must not block it.</p>
 */
@FunctionalInterface
public interface HubEventHandler
{
    void handle(HubEvent event);
}
