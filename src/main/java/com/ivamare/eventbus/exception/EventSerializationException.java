package com.ivamare.eventbus.exception;

/**
 * Raised when a payload cannot be converted to or from its wire format.
 */
public class EventSerializationException extends EventBusException {

    public EventSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
