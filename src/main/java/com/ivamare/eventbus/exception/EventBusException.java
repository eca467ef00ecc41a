package com.ivamare.eventbus.exception;

/**
 * Base exception for all Event Bus errors.
 */
public class EventBusException extends RuntimeException {

    public EventBusException(String message) {
        super(message);
    }

    public EventBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
