package com.ivamare.eventbus.api.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventbus.broker.ChannelPool;
import com.ivamare.eventbus.broker.OutboundMessage;
import com.ivamare.eventbus.codec.EventCodec;
import com.ivamare.eventbus.exception.BrokerException;
import com.ivamare.eventbus.model.EventKind;
import com.ivamare.eventbus.model.Microservice;
import com.ivamare.eventbus.model.events.OrderCreatedPayload;
import com.ivamare.eventbus.model.events.PaymentRequestedPayload;
import com.ivamare.eventbus.topology.QueueNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DefaultEventPublisher")
class DefaultEventPublisherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ChannelPool channelPool;

    @Captor
    private ArgumentCaptor<OutboundMessage> messageCaptor;

    private DefaultEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new DefaultEventPublisher(
            channelPool,
            new EventCodec(new ObjectMapper().findAndRegisterModules()),
            Microservice.ORDERS,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private static OrderCreatedPayload orderCreated() {
        return new OrderCreatedPayload("o-1", "u-1", new BigDecimal("42.00"), "EUR");
    }

    @Test
    @DisplayName("should publish to the matching exchange with the event kind header")
    void shouldPublishWithKindHeader() {
        String messageId = publisher.publish(orderCreated());

        verify(channelPool).publish(eq(QueueNames.MATCHING_EXCHANGE), eq(""), messageCaptor.capture());
        OutboundMessage message = messageCaptor.getValue();
        assertEquals("order.created", message.headers().get("event-kind"));
        assertEquals(messageId, message.messageId());
        assertEquals("orders", message.appId());
        assertEquals(NOW, message.timestamp());
        assertEquals("order.created", message.type());
        assertNull(message.expiration());
        assertFalse(message.headers().containsKey("x-retry-count"));
    }

    @Test
    @DisplayName("should generate a new message id per publish")
    void shouldGenerateMessageIds() {
        String first = publisher.publish(orderCreated());
        String second = publisher.publish(orderCreated());

        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("should reject audit kinds")
    void shouldRejectAuditKinds() {
        assertThrows(IllegalArgumentException.class,
            () -> publisher.publish(EventKind.AUDIT_RECEIVED, orderCreated()));
        verifyNoInteractions(channelPool);
    }

    @Test
    @DisplayName("should reject payloads of another kind")
    void shouldRejectMismatchedPayload() {
        assertThrows(IllegalArgumentException.class,
            () -> publisher.publish(EventKind.PAYMENT_REQUESTED, orderCreated()));
        verifyNoInteractions(channelPool);
    }

    @Test
    @DisplayName("should propagate broker failures to the caller")
    void shouldPropagateBrokerFailures() {
        doThrow(new BrokerException("connection lost"))
            .when(channelPool).publish(anyString(), anyString(), any());

        assertThrows(BrokerException.class, () -> publisher.publish(orderCreated()));
    }

    @Test
    @DisplayName("should commence a saga by publishing its first event")
    void shouldCommenceSaga() {
        publisher.commenceSaga(new PaymentRequestedPayload("o-1", "u-1", BigDecimal.TEN, "EUR"));

        verify(channelPool).publish(eq(QueueNames.MATCHING_EXCHANGE), eq(""), messageCaptor.capture());
        assertEquals("payment.requested", messageCaptor.getValue().headers().get("event-kind"));
    }
}
