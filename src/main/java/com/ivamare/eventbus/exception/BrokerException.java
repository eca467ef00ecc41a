package com.ivamare.eventbus.exception;

/**
 * Raised when the broker transport fails (closed channel, lost connection, I/O error).
 */
public class BrokerException extends EventBusException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
