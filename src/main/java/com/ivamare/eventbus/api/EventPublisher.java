package com.ivamare.eventbus.api;

import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventKind;

/**
 * Publishes business events to the headers exchange.
 *
 * <p>Publishing is fire-and-forget: a returned id means the local publish succeeded, not that
 * any consumer received the event. Audit records cannot be published here; they are produced
 * by the consumer pipeline.
 */
public interface EventPublisher {

    /**
     * Publish an event under the kind its payload declares.
     *
     * @param payload The event payload
     * @return the message id assigned to the event
     * @throws com.ivamare.eventbus.exception.EventSerializationException if the payload cannot be serialized
     * @throws com.ivamare.eventbus.exception.BrokerException if the broker write fails
     */
    String publish(BusinessEvent payload);

    /**
     * Publish an event under an explicit kind.
     *
     * @param kind The event kind
     * @param payload The event payload
     * @return the message id assigned to the event
     * @throws IllegalArgumentException if the payload does not belong to the kind
     */
    String publish(EventKind kind, BusinessEvent payload);

    /**
     * Start a saga by publishing the event that triggers its first step.
     *
     * @param firstStep The triggering event
     * @return the message id assigned to the event
     */
    String commenceSaga(BusinessEvent firstStep);
}
