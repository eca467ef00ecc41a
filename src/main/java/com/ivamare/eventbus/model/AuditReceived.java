package com.ivamare.eventbus.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Emitted when a consumer receives a business event, before its handler runs.
 *
 * @param publisherMicroservice Microservice that published the event
 * @param microservice Microservice that received it
 * @param receivedEvent Wire value of the received event kind
 * @param receivedAt Time of receipt
 * @param queueName Queue the event was consumed from
 * @param eventId Message id of the event
 * @param payload Captured event body, present only when payload capture is enabled
 * @param payloadTruncated Whether the captured body was cut at the configured size cap
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditReceived(
    String publisherMicroservice,
    String microservice,
    String receivedEvent,
    Instant receivedAt,
    String queueName,
    String eventId,
    String payload,
    boolean payloadTruncated
) implements AuditPayload {

    @Override
    public EventKind eventKind() {
        return EventKind.AUDIT_RECEIVED;
    }

    @Override
    @JsonIgnore
    public String auditedEvent() {
        return receivedEvent;
    }

    @Override
    @JsonIgnore
    public Instant occurredAt() {
        return receivedAt;
    }
}
