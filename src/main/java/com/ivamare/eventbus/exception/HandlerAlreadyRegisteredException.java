package com.ivamare.eventbus.exception;

import com.ivamare.eventbus.model.EventKind;

/**
 * Thrown when attempting to register a handler for an event kind that already has one.
 */
public class HandlerAlreadyRegisteredException extends EventBusException {

    private final EventKind eventKind;

    public HandlerAlreadyRegisteredException(EventKind eventKind) {
        super("Handler already registered for " + eventKind.getValue());
        this.eventKind = eventKind;
    }

    public EventKind getEventKind() {
        return eventKind;
    }
}
