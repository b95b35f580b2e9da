package com.questrail.homehub.runtime;

/**
 * The hub could not start: the live cache could not be seeded from storage,
 * the broker was unreachable, or the viewer port could not be bound.
 */
public class HubStartupException extends RuntimeException {

    public HubStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
