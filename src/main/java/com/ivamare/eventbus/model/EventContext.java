package com.ivamare.eventbus.model;

import java.time.Instant;

/**
 * Context provided to business event handlers.
 *
 * @param eventKind Kind of the event being handled
 * @param eventId Message id of the event
 * @param publisherMicroservice Microservice that published the event
 * @param microservice Microservice handling the event
 * @param queueName Queue the event was consumed from
 * @param attempt Retries already performed (0 on first delivery)
 * @param maxAttempts Maximum retries before the event is dead-lettered
 * @param receivedAt When the delivery was received
 */
public record EventContext(
    EventKind eventKind,
    String eventId,
    String publisherMicroservice,
    Microservice microservice,
    String queueName,
    int attempt,
    int maxAttempts,
    Instant receivedAt
) {
    /**
     * Check if a failure now would dead-letter the event.
     *
     * @return true if no more retries after this attempt
     */
    public boolean isLastAttempt() {
        return attempt >= maxAttempts;
    }
}
