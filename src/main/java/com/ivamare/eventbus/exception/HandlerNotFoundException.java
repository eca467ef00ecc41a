package com.ivamare.eventbus.exception;

import com.ivamare.eventbus.model.EventKind;

/**
 * Thrown when no handler is registered for a delivered event kind.
 */
public class HandlerNotFoundException extends EventBusException {

    private final EventKind eventKind;

    public HandlerNotFoundException(EventKind eventKind) {
        super("No handler registered for " + eventKind.getValue());
        this.eventKind = eventKind;
    }

    public EventKind getEventKind() {
        return eventKind;
    }
}
