package com.ivamare.eventbus.exception;

import com.ivamare.eventbus.model.EventKind;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExceptionTest {

    @Nested
    class EventBusExceptionTest {

        @Test
        void shouldCreateWithMessageAndCause() {
            RuntimeException cause = new RuntimeException("Original error");
            EventBusException exception = new EventBusException("Test message", cause);
            assertEquals("Test message", exception.getMessage());
            assertEquals(cause, exception.getCause());
        }

        @Test
        void shouldBeRuntimeException() {
            assertInstanceOf(RuntimeException.class, new EventBusException("Test"));
            assertInstanceOf(EventBusException.class, new BrokerException("Test"));
        }
    }

    @Nested
    class TransientEventExceptionTest {

        @Test
        void shouldCreateWithCodeAndMessage() {
            TransientEventException exception = new TransientEventException("TIMEOUT", "Gateway timed out");

            assertEquals("TIMEOUT", exception.getCode());
            assertEquals("Gateway timed out", exception.getErrorMessage());
            assertEquals("[TIMEOUT] Gateway timed out", exception.getMessage());
            assertEquals(Map.of(), exception.getDetails());
        }

        @Test
        void shouldCopyDetails() {
            Map<String, Object> details = new HashMap<>();
            details.put("retryAfter", 30);
            TransientEventException exception = new TransientEventException("TIMEOUT", "Gateway timed out", details);
            details.put("late", true);

            assertEquals(Map.of("retryAfter", 30), exception.getDetails());
        }

        @Test
        void shouldHandleNullDetails() {
            assertEquals(Map.of(), new TransientEventException("TIMEOUT", "x", null).getDetails());
        }
    }

    @Nested
    class PermanentEventExceptionTest {

        @Test
        void shouldCreateWithDetails() {
            PermanentEventException exception = new PermanentEventException(
                "INVALID_AMOUNT", "Amount must be positive", Map.of("amount", "-1"));

            assertEquals("INVALID_AMOUNT", exception.getCode());
            assertEquals("Amount must be positive", exception.getErrorMessage());
            assertEquals("[INVALID_AMOUNT] Amount must be positive", exception.getMessage());
            assertEquals(Map.of("amount", "-1"), exception.getDetails());
        }
    }

    @Nested
    class TopologyExceptionTest {

        @Test
        void shouldNameResourceAndKeepCause() {
            IOException cause = new IOException("PRECONDITION_FAILED");
            TopologyException exception = new TopologyException("payments__events", cause);

            assertEquals("payments__events", exception.getResource());
            assertEquals("Failed to declare payments__events: PRECONDITION_FAILED", exception.getMessage());
            assertSame(cause, exception.getCause());
        }
    }

    @Nested
    class HandlerExceptionsTest {

        @Test
        void shouldCarryEventKind() {
            HandlerNotFoundException notFound = new HandlerNotFoundException(EventKind.ORDER_CREATED);
            HandlerAlreadyRegisteredException duplicate =
                new HandlerAlreadyRegisteredException(EventKind.PAYMENT_REQUESTED);

            assertEquals(EventKind.ORDER_CREATED, notFound.getEventKind());
            assertEquals("No handler registered for order.created", notFound.getMessage());
            assertEquals(EventKind.PAYMENT_REQUESTED, duplicate.getEventKind());
            assertEquals("Handler already registered for payment.requested", duplicate.getMessage());
        }
    }
}
