package com.ivamare.eventbus.model;

import com.ivamare.eventbus.model.events.OrderCreatedPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EventKind and Microservice")
class EventKindTest {

    @Test
    @DisplayName("should resolve event kinds by wire value")
    void shouldResolveByWireValue() {
        assertEquals(Optional.of(EventKind.ORDER_CREATED), EventKind.fromValue("order.created"));
        assertEquals(Optional.of(EventKind.AUDIT_DEAD_LETTER), EventKind.fromValue("audit.dead_letter"));
        assertTrue(EventKind.fromValue("order.shipped").isEmpty());
        assertTrue(EventKind.fromValue(null).isEmpty());
    }

    @Test
    @DisplayName("should use the wire value as string form")
    void shouldUseWireValueAsString() {
        assertEquals("payment.requested", EventKind.PAYMENT_REQUESTED.toString());
    }

    @Test
    @DisplayName("should flag exactly the three audit kinds")
    void shouldFlagAuditKinds() {
        Set<EventKind> audit = Arrays.stream(EventKind.values())
            .filter(EventKind::isAudit)
            .collect(Collectors.toSet());

        assertEquals(Set.of(EventKind.AUDIT_RECEIVED, EventKind.AUDIT_PROCESSED, EventKind.AUDIT_DEAD_LETTER), audit);
    }

    @Test
    @DisplayName("should map business kinds to business payloads and audit kinds to audit records")
    void shouldMapPayloadTypes() {
        assertEquals(OrderCreatedPayload.class, EventKind.ORDER_CREATED.getPayloadType());
        for (EventKind kind : EventKind.values()) {
            Class<?> expected = kind.isAudit() ? AuditPayload.class : BusinessEvent.class;
            assertTrue(expected.isAssignableFrom(kind.getPayloadType()), kind.name());
        }
    }

    @Test
    @DisplayName("should use unique wire values without the x- prefix")
    void shouldUseUniqueWireValues() {
        Set<String> values = Arrays.stream(EventKind.values()).map(EventKind::getValue).collect(Collectors.toSet());

        assertEquals(EventKind.values().length, values.size());
        assertTrue(values.stream().noneMatch(v -> v.startsWith("x-")));
    }

    @Test
    @DisplayName("should resolve microservices by value or name")
    void shouldResolveMicroservice() {
        assertEquals(Microservice.AUDIT_EDA, Microservice.fromValue("audit-eda"));
        assertEquals(Microservice.PAYMENTS, Microservice.fromValue("PAYMENTS"));
        assertEquals(Microservice.AUTH, Microservice.fromValue("auth"));
        assertThrows(IllegalArgumentException.class, () -> Microservice.fromValue("billing"));
    }
}
