package com.ivamare.eventbus.exception;

import java.util.Map;

/**
 * Raised by handlers for retryable failures (network, timeout, temporary unavailability).
 *
 * <p>The event is redelivered according to the retry policy and dead-lettered once the
 * attempts are exhausted. Any other unexpected exception is treated the same way.
 */
public class TransientEventException extends EventBusException {

    private final String code;
    private final String errorMessage;
    private final Map<String, Object> details;

    public TransientEventException(String code, String message) {
        this(code, message, Map.of());
    }

    public TransientEventException(String code, String message, Map<String, Object> details) {
        super("[" + code + "] " + message);
        this.code = code;
        this.errorMessage = message;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public String getCode() {
        return code;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
