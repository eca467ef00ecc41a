package com.ivamare.eventbus.model.events;

import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventKind;

public record SocialBlockChatPayload(String userId, String userToBlockId) implements BusinessEvent {

    @Override
    public EventKind eventKind() {
        return EventKind.SOCIAL_BLOCK_CHAT;
    }
}
