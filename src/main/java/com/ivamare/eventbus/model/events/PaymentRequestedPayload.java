package com.ivamare.eventbus.model.events;

import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventKind;

import java.math.BigDecimal;

public record PaymentRequestedPayload(
    String orderId,
    String userId,
    BigDecimal amount,
    String currency
) implements BusinessEvent {

    @Override
    public EventKind eventKind() {
        return EventKind.PAYMENT_REQUESTED;
    }
}
