package com.ivamare.eventbus.model.events;

import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventKind;

public record OrderCancelledPayload(String orderId, String reason) implements BusinessEvent {

    @Override
    public EventKind eventKind() {
        return EventKind.ORDER_CANCELLED;
    }
}
