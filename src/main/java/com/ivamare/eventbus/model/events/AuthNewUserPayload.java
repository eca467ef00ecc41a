package com.ivamare.eventbus.model.events;

import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventKind;

public record AuthNewUserPayload(
    String id,
    String email,
    String username,
    String userlastname
) implements BusinessEvent {

    @Override
    public EventKind eventKind() {
        return EventKind.AUTH_NEW_USER;
    }
}
