package com.questrail.homehub.transport;

/**
 * The sensor broker could not be reached or refused the subscription.
 */
public class SensorTransportException extends Exception {

    public SensorTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
