package com.ivamare.eventbus.worker.impl;

import com.ivamare.eventbus.audit.AuditEmitter;
import com.ivamare.eventbus.broker.ChannelPool;
import com.ivamare.eventbus.broker.OutboundMessage;
import com.ivamare.eventbus.codec.EventCodec;
import com.ivamare.eventbus.exception.EventSerializationException;
import com.ivamare.eventbus.exception.HandlerNotFoundException;
import com.ivamare.eventbus.exception.PermanentEventException;
import com.ivamare.eventbus.handler.HandlerRegistry;
import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.Delivery;
import com.ivamare.eventbus.model.Disposition;
import com.ivamare.eventbus.model.EventContext;
import com.ivamare.eventbus.model.EventKind;
import com.ivamare.eventbus.model.MessageHeaders;
import com.ivamare.eventbus.policy.RetryDecision;
import com.ivamare.eventbus.policy.RetryPolicy;
import com.ivamare.eventbus.topology.QueueConsumerProps;
import com.ivamare.eventbus.topology.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Business event worker.
 *
 * <p>Every delivery goes through:
 * <ol>
 *   <li>{@code AuditReceived} is emitted;</li>
 *   <li>the payload is decoded and dispatched to the registered handler;</li>
 *   <li>on success {@code AuditProcessed} is emitted and the delivery acked;</li>
 *   <li>on failure the retry policy either schedules a delayed copy on the holding queue
 *       (no audit) or {@code AuditDeadLetter} is emitted and the delivery nacked without
 *       requeue, which moves it to the dead-letter queue.</li>
 * </ol>
 */
public class EventWorker extends AbstractQueueWorker {

    private static final Logger log = LoggerFactory.getLogger(EventWorker.class);

    private final ChannelPool channelPool;
    private final QueueConsumerProps consumer;
    private final EventCodec codec;
    private final HandlerRegistry handlerRegistry;
    private final AuditEmitter auditEmitter;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public EventWorker(
            ChannelPool channelPool,
            QueueConsumerProps consumer,
            EventCodec codec,
            HandlerRegistry handlerRegistry,
            AuditEmitter auditEmitter,
            RetryPolicy retryPolicy,
            int concurrency,
            Clock clock) {
        super(channelPool, consumer.microservice(), consumer.queueName(), concurrency);
        this.channelPool = channelPool;
        this.consumer = consumer;
        this.codec = codec;
        this.handlerRegistry = handlerRegistry;
        this.auditEmitter = auditEmitter;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    @Override
    protected Disposition process(Delivery delivery, Settlement settlement) {
        String rawKind = delivery.eventKindHeader().orElse(MessageHeaders.UNKNOWN);

        log.debug("Processing delivery {} on {} (event={}, eventId={}, attempt={})",
            delivery.deliveryTag(), queueName(), rawKind, delivery.eventId(), delivery.retryCount());

        auditEmitter.received(microservice(), queueName(), rawKind, delivery);

        Optional<EventKind> resolved = EventKind.fromValue(rawKind).filter(kind -> !kind.isAudit());
        if (resolved.isEmpty()) {
            return deadLetter(delivery, settlement, rawKind,
                "Unknown event kind: " + rawKind, delivery.retryCount());
        }
        EventKind kind = resolved.get();

        EventContext context = new EventContext(
            kind,
            delivery.eventId(),
            delivery.publisher(),
            microservice(),
            queueName(),
            delivery.retryCount(),
            retryPolicy.maxAttempts(),
            clock.instant()
        );

        try {
            BusinessEvent payload = (BusinessEvent) codec.decode(kind, delivery.body());
            handlerRegistry.dispatch(payload, context);
        } catch (EventSerializationException e) {
            return deadLetter(delivery, settlement, rawKind,
                "Malformed payload: " + e.getMessage(), delivery.retryCount());
        } catch (HandlerNotFoundException e) {
            return deadLetter(delivery, settlement, rawKind, e.getMessage(), delivery.retryCount());
        } catch (PermanentEventException e) {
            return deadLetter(delivery, settlement, rawKind,
                "Permanent failure: " + e.getMessage(), delivery.retryCount());
        } catch (Exception e) {
            return retryOrDeadLetter(delivery, settlement, kind, e);
        } catch (Error e) {
            if (e instanceof VirtualMachineError) {
                throw e;
            }
            return retryOrDeadLetter(delivery, settlement, kind, e);
        }

        return complete(delivery, settlement, kind);
    }

    // --- Outcomes ---

    private Disposition complete(Delivery delivery, Settlement settlement, EventKind kind) {
        auditEmitter.processed(microservice(), queueName(), kind.getValue(), delivery);
        settle(settlement::ack, delivery);

        log.info("Processed {} on {} (eventId={})", kind, queueName(), delivery.eventId());
        return Disposition.ACKED;
    }

    private Disposition retryOrDeadLetter(Delivery delivery, Settlement settlement,
                                          EventKind kind, Throwable failure) {
        RetryDecision decision = retryPolicy.decide(delivery);

        if (!decision.retry()) {
            return deadLetter(delivery, settlement, kind.getValue(),
                "Retries exhausted: " + describe(failure), decision.attempt());
        }

        Map<String, Object> headers = new HashMap<>(delivery.headers());
        headers.put(MessageHeaders.RETRY_COUNT, decision.attempt());
        if (decision.occurrence() > 0) {
            headers.put(MessageHeaders.OCCURRENCE, decision.occurrence());
        }

        OutboundMessage copy = new OutboundMessage(
            delivery.body(),
            headers,
            delivery.messageId(),
            delivery.appId(),
            delivery.timestamp(),
            Long.toString(decision.delay().toMillis()),
            kind.getValue()
        );

        try {
            channelPool.publish(QueueNames.DEFAULT_EXCHANGE, consumer.requeueQueueName(), copy);
        } catch (RuntimeException e) {
            log.error("Failed to schedule retry for {} (eventId={}), returning it to {}: {}",
                kind, delivery.eventId(), queueName(), e.getMessage());
            settle(() -> settlement.nack(true), delivery);
            return Disposition.REQUEUED;
        }

        settle(settlement::ack, delivery);

        log.info("Scheduled retry {}/{} for {} in {}ms (eventId={}): {}",
            decision.attempt(), retryPolicy.maxAttempts(), kind, decision.delay().toMillis(),
            delivery.eventId(), describe(failure));
        return Disposition.REQUEUED;
    }

    private Disposition deadLetter(Delivery delivery, Settlement settlement, String eventKind,
                                   String reason, int attempts) {
        auditEmitter.deadLetter(microservice(), queueName(), eventKind, delivery, reason, attempts);
        settle(() -> settlement.nack(false), delivery);

        log.warn("Dead-lettered {} from {} after {} retries (eventId={}): {}",
            eventKind, queueName(), attempts, delivery.eventId(), reason);
        return Disposition.DEAD_LETTERED;
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message == null ? failure.getClass().getSimpleName() : message;
    }
}
