package com.ivamare.eventbus.model;

/**
 * Payload of a business event, routed through the headers exchange.
 *
 * <p>Only business events can be handed to {@link com.ivamare.eventbus.api.EventPublisher};
 * audit records are produced exclusively by the consumer pipeline.
 */
public interface BusinessEvent extends EventPayload {
}
