package com.ivamare.eventbus.model;

import java.time.Instant;

/**
 * Audit record describing one step in the lifecycle of a delivered business event.
 */
public sealed interface AuditPayload extends EventPayload
    permits AuditReceived, AuditProcessed, AuditDeadLetter {

    /**
     * @return microservice that published the audited event
     */
    String publisherMicroservice();

    /**
     * @return microservice whose consumer produced this record
     */
    String microservice();

    /**
     * @return wire value of the audited event kind
     */
    String auditedEvent();

    /**
     * @return message id of the audited event
     */
    String eventId();

    /**
     * @return when the audited step happened
     */
    Instant occurredAt();
}
