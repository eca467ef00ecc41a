package com.ivamare.eventbus.worker.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventbus.api.impl.DefaultEventPublisher;
import com.ivamare.eventbus.audit.AuditEmitter;
import com.ivamare.eventbus.audit.AuditOptions;
import com.ivamare.eventbus.broker.InMemoryBroker;
import com.ivamare.eventbus.broker.OutboundMessage;
import com.ivamare.eventbus.codec.EventCodec;
import com.ivamare.eventbus.exception.PermanentEventException;
import com.ivamare.eventbus.handler.impl.DefaultHandlerRegistry;
import com.ivamare.eventbus.model.AuditDeadLetter;
import com.ivamare.eventbus.model.EventContext;
import com.ivamare.eventbus.model.EventKind;
import com.ivamare.eventbus.model.MessageHeaders;
import com.ivamare.eventbus.model.Microservice;
import com.ivamare.eventbus.model.events.PaymentRequestedPayload;
import com.ivamare.eventbus.policy.RetryPolicy;
import com.ivamare.eventbus.topology.QueueConsumerProps;
import com.ivamare.eventbus.topology.QueueNames;
import com.ivamare.eventbus.topology.Topology;
import com.ivamare.eventbus.worker.Worker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("EventWorker")
class EventWorkerTest {

    private static final QueueConsumerProps PAYMENTS =
        QueueConsumerProps.of(Microservice.PAYMENTS, EventKind.PAYMENT_REQUESTED);
    private static final String AUDIT_QUEUE = "payments__audit";

    private InMemoryBroker broker;
    private EventCodec codec;
    private DefaultHandlerRegistry registry;
    private DefaultEventPublisher publisher;
    private Worker worker;

    @BeforeEach
    void setUp() {
        broker = new InMemoryBroker();
        codec = new EventCodec(new ObjectMapper().findAndRegisterModules());
        registry = new DefaultHandlerRegistry();
        publisher = new DefaultEventPublisher(broker, codec, Microservice.ORDERS);
        new Topology(broker).declare(List.of(PAYMENTS));

        worker = Worker.builder()
            .channelPool(broker)
            .codec(codec)
            .consumer(PAYMENTS)
            .handlerRegistry(registry)
            .auditEmitter(new AuditEmitter(broker, codec, AuditOptions.defaults()))
            .retryPolicy(RetryPolicy.fibonacci(Duration.ofSeconds(1), 3))
            .build();
    }

    @AfterEach
    void tearDown() {
        worker.stop(Duration.ofSeconds(2)).join();
        broker.close();
    }

    private static PaymentRequestedPayload payment(String orderId) {
        return new PaymentRequestedPayload(orderId, "u-1", new BigDecimal("19.99"), "EUR");
    }

    private List<String> auditKinds() {
        return broker.messagesIn(AUDIT_QUEUE).stream()
            .map(m -> (String) m.headers().get(MessageHeaders.EVENT_KIND))
            .toList();
    }

    private void sendRaw(String eventKind, String body) {
        broker.publish(QueueNames.DEFAULT_EXCHANGE, PAYMENTS.queueName(), new OutboundMessage(
            body.getBytes(StandardCharsets.UTF_8),
            Map.of(MessageHeaders.EVENT_KIND, eventKind),
            "raw-1", "orders", Instant.now(), null, eventKind));
    }

    @Nested
    @DisplayName("on success")
    class Success {

        @Test
        @DisplayName("should emit received before the handler runs, then processed, then ack")
        void shouldAuditAndAck() {
            List<List<String>> auditSeenByHandler = new CopyOnWriteArrayList<>();
            registry.register(EventKind.PAYMENT_REQUESTED, PaymentRequestedPayload.class,
                (payload, context) -> auditSeenByHandler.add(auditKinds()));
            worker.start();

            publisher.publish(payment("o-1"));

            await().atMost(Duration.ofSeconds(5))
                .until(() -> auditKinds().equals(List.of("audit.received", "audit.processed")));
            assertEquals(List.of(List.of("audit.received")), auditSeenByHandler);
            assertEquals(0, broker.messageCount(PAYMENTS.queueName()));
            assertEquals(0, broker.messageCount(PAYMENTS.deadLetterQueueName()));
            assertTrue(broker.expirations(PAYMENTS.requeueQueueName()).isEmpty());
        }

        @Test
        @DisplayName("should pass delivery details in the context")
        void shouldPassContext() {
            List<EventContext> contexts = new CopyOnWriteArrayList<>();
            registry.register(EventKind.PAYMENT_REQUESTED, PaymentRequestedPayload.class,
                (payload, context) -> contexts.add(context));
            worker.start();

            String eventId = publisher.publish(payment("o-1"));

            await().atMost(Duration.ofSeconds(5)).until(() -> contexts.size() == 1);
            EventContext context = contexts.get(0);
            assertEquals(EventKind.PAYMENT_REQUESTED, context.eventKind());
            assertEquals(eventId, context.eventId());
            assertEquals("orders", context.publisherMicroservice());
            assertEquals(Microservice.PAYMENTS, context.microservice());
            assertEquals("payments__events", context.queueName());
            assertEquals(0, context.attempt());
            assertEquals(3, context.maxAttempts());
        }
    }

    @Nested
    @DisplayName("on failure")
    class Failure {

        @Test
        @DisplayName("should retry through the holding queue without a dead-letter audit")
        void shouldRetryWithIncrementedHeader() {
            List<Integer> attempts = new CopyOnWriteArrayList<>();
            registry.register(EventKind.PAYMENT_REQUESTED, PaymentRequestedPayload.class, (payload, context) -> {
                attempts.add(context.attempt());
                if (attempts.size() < 3) {
                    throw new IllegalStateException("gateway timeout");
                }
            });
            worker.start();

            publisher.publish(payment("o-1"));

            await().atMost(Duration.ofSeconds(5)).until(() -> auditKinds().contains("audit.processed"));
            assertEquals(List.of(0, 1, 2), attempts);
            assertEquals(List.of("1000", "1000"), broker.expirations(PAYMENTS.requeueQueueName()));
            assertEquals(List.of("audit.received", "audit.received", "audit.received", "audit.processed"),
                auditKinds());
            assertEquals(0, broker.messageCount(PAYMENTS.deadLetterQueueName()));
        }

        @Test
        @DisplayName("should dead-letter with an AuditDeadLetter once retries are exhausted")
        void shouldDeadLetterWhenExhausted() {
            AtomicInteger calls = new AtomicInteger();
            registry.register(EventKind.PAYMENT_REQUESTED, PaymentRequestedPayload.class, (payload, context) -> {
                calls.incrementAndGet();
                throw new IllegalStateException("card declined");
            });
            worker.start();

            publisher.publish(payment("o-1"));

            await().atMost(Duration.ofSeconds(5))
                .until(() -> broker.messageCount(PAYMENTS.deadLetterQueueName()) == 1);
            await().atMost(Duration.ofSeconds(2)).until(() -> auditKinds().contains("audit.dead_letter"));

            assertEquals(4, calls.get());
            assertEquals(List.of("1000", "1000", "2000"), broker.expirations(PAYMENTS.requeueQueueName()));
            OutboundMessage dead = broker.messagesIn(PAYMENTS.deadLetterQueueName()).get(0);
            assertEquals(3, dead.headers().get(MessageHeaders.RETRY_COUNT));

            List<String> kinds = auditKinds();
            assertEquals("audit.dead_letter", kinds.get(kinds.size() - 1));
            assertEquals(4, kinds.stream().filter("audit.received"::equals).count());
            assertFalse(kinds.contains("audit.processed"));

            OutboundMessage record = broker.messagesIn(AUDIT_QUEUE).get(kinds.size() - 1);
            AuditDeadLetter deadLetter = codec.decode(record.body(), AuditDeadLetter.class);
            assertEquals(3, deadLetter.attempts());
            assertThat(deadLetter.rejectionReason()).contains("card declined");
        }

        @Test
        @DisplayName("should dead-letter permanent failures without retrying")
        void shouldDeadLetterPermanentFailures() {
            AtomicInteger calls = new AtomicInteger();
            registry.register(EventKind.PAYMENT_REQUESTED, PaymentRequestedPayload.class, (payload, context) -> {
                calls.incrementAndGet();
                throw new PermanentEventException("INVALID_CARD", "card number invalid");
            });
            worker.start();

            publisher.publish(payment("o-1"));

            await().atMost(Duration.ofSeconds(5))
                .until(() -> broker.messageCount(PAYMENTS.deadLetterQueueName()) == 1);
            assertEquals(1, calls.get());
            assertTrue(broker.expirations(PAYMENTS.requeueQueueName()).isEmpty());
        }

        @Test
        @DisplayName("should contain handler errors and keep consuming")
        void shouldContainHandlerErrors() {
            List<String> handled = new CopyOnWriteArrayList<>();
            registry.register(EventKind.PAYMENT_REQUESTED, PaymentRequestedPayload.class, (payload, context) -> {
                if (payload.orderId().equals("boom")) {
                    throw new AssertionError("handler bug");
                }
                handled.add(payload.orderId());
            });
            worker = Worker.builder()
                .channelPool(broker)
                .codec(codec)
                .consumer(PAYMENTS)
                .handlerRegistry(registry)
                .auditEmitter(new AuditEmitter(broker, codec, AuditOptions.defaults()))
                .retryPolicy(RetryPolicy.noRetry())
                .build();
            worker.start();

            publisher.publish(payment("boom"));
            publisher.publish(payment("o-2"));

            await().atMost(Duration.ofSeconds(5)).until(() -> handled.contains("o-2"));
            assertTrue(worker.isRunning());
            assertEquals(1, broker.messageCount(PAYMENTS.deadLetterQueueName()));
        }

        @Test
        @DisplayName("should return the delivery to its queue when the retry cannot be scheduled")
        void shouldRequeueWhenRetryPublishFails() {
            List<Integer> attempts = new CopyOnWriteArrayList<>();
            registry.register(EventKind.PAYMENT_REQUESTED, PaymentRequestedPayload.class, (payload, context) -> {
                attempts.add(context.attempt());
                if (attempts.size() == 1) {
                    broker.failPublishesTo(QueueNames.DEFAULT_EXCHANGE);
                    throw new IllegalStateException("first failure");
                }
            });
            worker.start();

            publisher.publish(payment("o-1"));

            await().atMost(Duration.ofSeconds(5)).until(() -> {
                broker.restorePublishes();
                return auditKinds().contains("audit.processed");
            });
            assertEquals(List.of(0, 0), attempts);
        }

        @Test
        @DisplayName("should cap the retry delay of an oversized occurrence header and keep consuming")
        void shouldCapDelayForLargeOccurrenceHeader() {
            List<String> handled = new CopyOnWriteArrayList<>();
            registry.register(EventKind.PAYMENT_REQUESTED, PaymentRequestedPayload.class, (payload, context) -> {
                handled.add(payload.orderId());
                if (payload.orderId().equals("o-stale")) {
                    throw new IllegalStateException("gateway timeout");
                }
            });
            worker.start();

            broker.publish(QueueNames.DEFAULT_EXCHANGE, PAYMENTS.queueName(), new OutboundMessage(
                codec.encode(payment("o-stale")),
                Map.of(MessageHeaders.EVENT_KIND, "payment.requested", MessageHeaders.OCCURRENCE, 91),
                "raw-1", "orders", Instant.now(), null, "payment.requested"));
            publisher.publish(payment("o-fresh"));

            await().atMost(Duration.ofSeconds(5))
                .until(() -> broker.messageCount(PAYMENTS.deadLetterQueueName()) == 1);
            await().atMost(Duration.ofSeconds(2)).until(() -> auditKinds().contains("audit.processed"));

            String maxExpiration = Long.toString(RetryPolicy.MAX_BACKOFF.toMillis());
            assertEquals(List.of(maxExpiration, maxExpiration, maxExpiration),
                broker.expirations(PAYMENTS.requeueQueueName()));
            assertEquals(4, handled.stream().filter("o-stale"::equals).count());
            assertTrue(handled.contains("o-fresh"));
        }
    }

    @Nested
    @DisplayName("poison messages")
    class PoisonMessages {

        @Test
        @DisplayName("should dead-letter unknown event kinds after auditing receipt")
        void shouldDeadLetterUnknownKind() {
            worker.start();

            sendRaw("order.shipped", "{}");

            await().atMost(Duration.ofSeconds(5))
                .until(() -> broker.messageCount(PAYMENTS.deadLetterQueueName()) == 1);
            await().atMost(Duration.ofSeconds(2))
                .until(() -> auditKinds().equals(List.of("audit.received", "audit.dead_letter")));
        }

        @Test
        @DisplayName("should dead-letter malformed bodies without calling the handler")
        void shouldDeadLetterMalformedBody() {
            AtomicInteger calls = new AtomicInteger();
            registry.register(EventKind.PAYMENT_REQUESTED, PaymentRequestedPayload.class,
                (payload, context) -> calls.incrementAndGet());
            worker.start();

            sendRaw("payment.requested", "not json");

            await().atMost(Duration.ofSeconds(5))
                .until(() -> broker.messageCount(PAYMENTS.deadLetterQueueName()) == 1);
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("should dead-letter events without a registered handler")
        void shouldDeadLetterWithoutHandler() {
            worker.start();

            publisher.publish(payment("o-1"));

            await().atMost(Duration.ofSeconds(5))
                .until(() -> broker.messageCount(PAYMENTS.deadLetterQueueName()) == 1);
        }
    }

    @Test
    @DisplayName("should still process and ack when audit publishing fails")
    void shouldProcessWhenAuditFails() {
        AtomicInteger calls = new AtomicInteger();
        registry.register(EventKind.PAYMENT_REQUESTED, PaymentRequestedPayload.class,
            (payload, context) -> calls.incrementAndGet());
        broker.failPublishesTo(QueueNames.AUDIT_EXCHANGE);
        worker.start();

        publisher.publish(payment("o-1"));

        await().atMost(Duration.ofSeconds(5)).until(() -> calls.get() == 1);
        await().atMost(Duration.ofSeconds(2)).until(() -> worker.inFlightCount() == 0);
        assertEquals(0, broker.messageCount(PAYMENTS.queueName()));
        assertEquals(0, broker.messageCount(PAYMENTS.deadLetterQueueName()));
        assertEquals(0, broker.messageCount(AUDIT_QUEUE));
    }

    @Test
    @DisplayName("should reject a delivery left unsettled by an unexpected error and keep consuming")
    void shouldRejectUnsettledDelivery() {
        AuditEmitter failingEmitter = mock(AuditEmitter.class);
        when(failingEmitter.received(any(), any(), any(), any()))
            .thenThrow(new IllegalStateException("emitter misconfigured"));
        worker = Worker.builder()
            .channelPool(broker)
            .codec(codec)
            .consumer(PAYMENTS)
            .handlerRegistry(registry)
            .auditEmitter(failingEmitter)
            .retryPolicy(RetryPolicy.defaultPolicy())
            .build();
        worker.start();

        publisher.publish(payment("o-1"));
        publisher.publish(payment("o-2"));

        await().atMost(Duration.ofSeconds(5))
            .until(() -> broker.messageCount(PAYMENTS.deadLetterQueueName()) == 2);
        await().atMost(Duration.ofSeconds(2)).until(() -> worker.inFlightCount() == 0);
        assertEquals(0, broker.messageCount(PAYMENTS.queueName()));
        assertTrue(worker.isRunning());
    }

    @Test
    @DisplayName("should report its queue and stop cleanly")
    void shouldStartAndStop() {
        worker.start();

        assertTrue(worker.isRunning());
        assertEquals("payments__events", worker.queueName());
        assertEquals(Microservice.PAYMENTS, worker.microservice());

        worker.stop(Duration.ofSeconds(2)).join();

        assertFalse(worker.isRunning());
    }

    @Test
    @DisplayName("should stop running when the broker cancels the consumer")
    void shouldStopWhenConsumerCancelled() {
        worker.start();

        broker.cancelConsumers(PAYMENTS.queueName(), "queue deleted");

        await().atMost(Duration.ofSeconds(2)).until(() -> !worker.isRunning());
        assertEquals(1, worker.getConsecutiveErrorCount());
    }

    @Test
    @DisplayName("should release its handler threads when the broker cancels the consumer")
    void shouldReleaseThreadsWhenConsumerCancelled() {
        AtomicInteger calls = new AtomicInteger();
        registry.register(EventKind.PAYMENT_REQUESTED, PaymentRequestedPayload.class,
            (payload, context) -> calls.incrementAndGet());
        worker.start();
        publisher.publish(payment("o-1"));
        await().atMost(Duration.ofSeconds(5)).until(() -> calls.get() == 1);
        await().atMost(Duration.ofSeconds(2)).until(() -> worker.inFlightCount() == 0);

        broker.cancelConsumers(PAYMENTS.queueName(), "queue deleted");

        await().atMost(Duration.ofSeconds(5)).until(() -> Thread.getAllStackTraces().keySet().stream()
            .noneMatch(t -> t.getName().startsWith("eventbus-payments__events-")));
    }
}
