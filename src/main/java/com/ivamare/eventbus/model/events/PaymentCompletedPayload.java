package com.ivamare.eventbus.model.events;

import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventKind;

public record PaymentCompletedPayload(String orderId, String paymentId) implements BusinessEvent {

    @Override
    public EventKind eventKind() {
        return EventKind.PAYMENT_COMPLETED;
    }
}
