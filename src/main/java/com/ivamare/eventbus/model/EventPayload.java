package com.ivamare.eventbus.model;

/**
 * Payload carried by an event on the wire.
 *
 * <p>Every payload knows which {@link EventKind} it belongs to, so the kind never has to be
 * passed around separately from the data.
 */
public interface EventPayload {

    /**
     * @return the kind this payload is published as
     */
    EventKind eventKind();
}
