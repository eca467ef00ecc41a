package com.ivamare.eventbus.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Emitted when a delivery is given up on, right before it is nacked to the dead-letter queue.
 *
 * @param publisherMicroservice Microservice that published the event
 * @param microservice Microservice that rejected it
 * @param rejectedEvent Wire value of the rejected event kind
 * @param rejectedAt Time of rejection
 * @param queueName Queue the event was consumed from
 * @param rejectionReason Why the event was dead-lettered
 * @param attempts Number of retries performed before giving up
 * @param eventId Message id of the event
 * @param payload Captured event body, present only when payload capture is enabled
 * @param payloadTruncated Whether the captured body was cut at the configured size cap
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditDeadLetter(
    String publisherMicroservice,
    String microservice,
    String rejectedEvent,
    Instant rejectedAt,
    String queueName,
    String rejectionReason,
    int attempts,
    String eventId,
    String payload,
    boolean payloadTruncated
) implements AuditPayload {

    @Override
    public EventKind eventKind() {
        return EventKind.AUDIT_DEAD_LETTER;
    }

    @Override
    @JsonIgnore
    public String auditedEvent() {
        return rejectedEvent;
    }

    @Override
    @JsonIgnore
    public Instant occurredAt() {
        return rejectedAt;
    }
}
