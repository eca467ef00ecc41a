package com.ivamare.eventbus.handler;

import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventContext;

/**
 * Handler for one kind of business event.
 *
 * <p>Returning normally means success. Throwing
 * {@link com.ivamare.eventbus.exception.PermanentEventException} dead-letters the event right
 * away; any other exception is retried according to the retry policy. Handlers never ack or
 * nack themselves.
 *
 * @param <P> payload type
 */
@FunctionalInterface
public interface EventHandler<P extends BusinessEvent> {

    /**
     * Handle an event.
     *
     * @param payload The decoded payload
     * @param context Delivery context
     * @throws Exception on failure
     */
    void handle(P payload, EventContext context) throws Exception;
}
