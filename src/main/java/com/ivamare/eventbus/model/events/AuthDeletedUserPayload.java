package com.ivamare.eventbus.model.events;

import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventKind;

public record AuthDeletedUserPayload(String userId) implements BusinessEvent {

    @Override
    public EventKind eventKind() {
        return EventKind.AUTH_DELETED_USER;
    }
}
