package com.ivamare.eventbus.model;

import com.ivamare.eventbus.model.events.AuthDeletedUserPayload;
import com.ivamare.eventbus.model.events.AuthNewUserPayload;
import com.ivamare.eventbus.model.events.OrderCancelledPayload;
import com.ivamare.eventbus.model.events.OrderCompletedPayload;
import com.ivamare.eventbus.model.events.OrderCreatedPayload;
import com.ivamare.eventbus.model.events.PaymentCompletedPayload;
import com.ivamare.eventbus.model.events.PaymentFailedPayload;
import com.ivamare.eventbus.model.events.PaymentRequestedPayload;
import com.ivamare.eventbus.model.events.SocialBlockChatPayload;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of event kinds known to the bus.
 *
 * <p>The wire value is what travels in the {@code event-kind} header and is matched by the
 * headers exchange bindings. Adding a kind means adding a constant here together with the
 * record its payload is decoded into.
 */
public enum EventKind {

    ORDER_CREATED("order.created", OrderCreatedPayload.class),
    ORDER_CANCELLED("order.cancelled", OrderCancelledPayload.class),
    ORDER_COMPLETED("order.completed", OrderCompletedPayload.class),
    PAYMENT_REQUESTED("payment.requested", PaymentRequestedPayload.class),
    PAYMENT_COMPLETED("payment.completed", PaymentCompletedPayload.class),
    PAYMENT_FAILED("payment.failed", PaymentFailedPayload.class),
    AUTH_NEW_USER("auth.new_user", AuthNewUserPayload.class),
    AUTH_DELETED_USER("auth.deleted_user", AuthDeletedUserPayload.class),
    SOCIAL_BLOCK_CHAT("social.block_chat", SocialBlockChatPayload.class),

    AUDIT_RECEIVED("audit.received", AuditReceived.class),
    AUDIT_PROCESSED("audit.processed", AuditProcessed.class),
    AUDIT_DEAD_LETTER("audit.dead_letter", AuditDeadLetter.class);

    private static final Map<String, EventKind> BY_VALUE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(EventKind::getValue, Function.identity()));

    private final String value;
    private final Class<? extends EventPayload> payloadType;

    EventKind(String value, Class<? extends EventPayload> payloadType) {
        this.value = value;
        this.payloadType = payloadType;
    }

    public String getValue() {
        return value;
    }

    public Class<? extends EventPayload> getPayloadType() {
        return payloadType;
    }

    /**
     * Audit kinds are only ever produced by the consumer pipeline and are never audited.
     *
     * @return true for the three audit kinds
     */
    public boolean isAudit() {
        return AuditPayload.class.isAssignableFrom(payloadType);
    }

    /**
     * Resolve a wire value.
     *
     * @param value header value, may be null
     * @return the matching kind, or empty when the value is unknown
     */
    public static Optional<EventKind> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_VALUE.get(value));
    }

    @Override
    public String toString() {
        return value;
    }
}
