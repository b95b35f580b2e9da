package com.questrail.homehub.store;

/**
 * A {@link ReadingStore} operation failed.
 */
public class PersistenceException extends Exception {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
