package com.ivamare.eventbus.exception;

/**
 * Thrown when an invalid state transition or operation is attempted.
 */
public class InvalidOperationException extends EventBusException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
