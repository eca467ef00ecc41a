package com.ivamare.eventbus.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Emitted after a business handler completed successfully, before the delivery is acked.
 *
 * @param publisherMicroservice Microservice that published the event
 * @param microservice Microservice that processed it
 * @param processedEvent Wire value of the processed event kind
 * @param processedAt Time of completion
 * @param queueName Queue the event was consumed from
 * @param eventId Message id of the event
 */
public record AuditProcessed(
    String publisherMicroservice,
    String microservice,
    String processedEvent,
    Instant processedAt,
    String queueName,
    String eventId
) implements AuditPayload {

    @Override
    public EventKind eventKind() {
        return EventKind.AUDIT_PROCESSED;
    }

    @Override
    @JsonIgnore
    public String auditedEvent() {
        return processedEvent;
    }

    @Override
    @JsonIgnore
    public Instant occurredAt() {
        return processedAt;
    }
}
