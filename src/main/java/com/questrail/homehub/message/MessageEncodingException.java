package com.questrail.homehub.message;

/**
 * Raised when a viewer message cannot be serialized to JSON.
 */
public final class MessageEncodingException extends RuntimeException {

    public MessageEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
