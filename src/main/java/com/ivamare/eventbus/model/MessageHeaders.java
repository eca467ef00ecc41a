package com.ivamare.eventbus.model;

/**
 * Names of the message headers the bus reads and writes.
 */
public final class MessageHeaders {

    /**
     * Event kind wire value. Matched by the headers exchange, so it must not start with
     * {@code x-} (RabbitMQ skips those when matching).
     */
    public static final String EVENT_KIND = "event-kind";

    /**
     * Number of retries already performed for the message.
     */
    public static final String RETRY_COUNT = "x-retry-count";

    /**
     * Position in the fibonacci sequence used for the last retry delay.
     */
    public static final String OCCURRENCE = "x-occurrence";

    /**
     * Reason recorded on a message that was dead-lettered by the pipeline.
     */
    public static final String REJECTION_REASON = "x-rejection-reason";

    /**
     * Headers exchange match mode argument.
     */
    public static final String X_MATCH = "x-match";

    public static final String UNKNOWN = "unknown";

    private MessageHeaders() {
        // Utility class
    }
}
