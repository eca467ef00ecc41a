package com.ivamare.eventbus.model.events;

import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventKind;

public record PaymentFailedPayload(String orderId, String code, String reason) implements BusinessEvent {

    @Override
    public EventKind eventKind() {
        return EventKind.PAYMENT_FAILED;
    }
}
