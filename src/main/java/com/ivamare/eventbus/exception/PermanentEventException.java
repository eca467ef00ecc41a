package com.ivamare.eventbus.exception;

import java.util.Map;

/**
 * Raised by handlers for non-retryable failures (validation, malformed data).
 *
 * <p>The event is dead-lettered immediately without retrying.
 */
public class PermanentEventException extends EventBusException {

    private final String code;
    private final String errorMessage;
    private final Map<String, Object> details;

    public PermanentEventException(String code, String message) {
        this(code, message, Map.of());
    }

    public PermanentEventException(String code, String message, Map<String, Object> details) {
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
