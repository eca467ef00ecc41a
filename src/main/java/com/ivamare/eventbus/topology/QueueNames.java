package com.ivamare.eventbus.topology;

import com.ivamare.eventbus.model.Microservice;

/**
 * Exchange and queue naming conventions.
 */
public final class QueueNames {

    /**
     * Headers exchange for business events.
     */
    public static final String MATCHING_EXCHANGE = "matching_exchange";

    /**
     * Direct exchange for audit records, keyed by microservice.
     */
    public static final String AUDIT_EXCHANGE = "audit_exchange";

    /**
     * Direct exchange receiving messages rejected without requeue, keyed by source queue.
     */
    public static final String DEAD_LETTER_EXCHANGE = "dead_letter_exchange";

    /**
     * The broker's default exchange, which routes by queue name.
     */
    public static final String DEFAULT_EXCHANGE = "";

    public static final String SEPARATOR = "__";
    public static final String EVENTS_SUFFIX = "events";
    public static final String REQUEUE_SUFFIX = "requeue";
    public static final String DEAD_LETTER_SUFFIX = "dead_letter";
    public static final String AUDIT_SUFFIX = "audit";

    private QueueNames() {
        // Utility class
    }

    /**
     * Business queue of a microservice.
     *
     * @param microservice The microservice
     * @return Queue name (e.g., "payments__events")
     */
    public static String eventQueue(Microservice microservice) {
        return microservice.getValue() + SEPARATOR + EVENTS_SUFFIX;
    }

    /**
     * Holding queue where failed events wait out their retry delay.
     */
    public static String requeueQueue(Microservice microservice) {
        return microservice.getValue() + SEPARATOR + REQUEUE_SUFFIX;
    }

    public static String deadLetterQueue(Microservice microservice) {
        return microservice.getValue() + SEPARATOR + DEAD_LETTER_SUFFIX;
    }

    /**
     * Audit trail queue of a microservice.
     */
    public static String auditQueue(Microservice microservice) {
        return microservice.getValue() + SEPARATOR + AUDIT_SUFFIX;
    }

    /**
     * Routing key of a microservice on the audit exchange.
     */
    public static String auditRoutingKey(Microservice microservice) {
        return microservice.getValue();
    }
}
