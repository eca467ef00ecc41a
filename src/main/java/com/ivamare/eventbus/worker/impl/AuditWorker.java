package com.ivamare.eventbus.worker.impl;

import com.ivamare.eventbus.audit.AuditHandlerRegistry;
import com.ivamare.eventbus.broker.ChannelPool;
import com.ivamare.eventbus.codec.EventCodec;
import com.ivamare.eventbus.model.AuditContext;
import com.ivamare.eventbus.model.AuditPayload;
import com.ivamare.eventbus.model.Delivery;
import com.ivamare.eventbus.model.Disposition;
import com.ivamare.eventbus.model.EventKind;
import com.ivamare.eventbus.model.MessageHeaders;
import com.ivamare.eventbus.model.Microservice;
import com.ivamare.eventbus.topology.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Consumer of a microservice's audit queue.
 *
 * <p>Holds neither a publisher nor an audit emitter, so handling an audit record cannot emit
 * another one. Records are acked once handled; records that cannot be handled are rejected
 * without requeue and logged.
 */
public class AuditWorker extends AbstractQueueWorker {

    private static final Logger log = LoggerFactory.getLogger(AuditWorker.class);

    private final EventCodec codec;
    private final AuditHandlerRegistry handlerRegistry;
    private final Clock clock;

    public AuditWorker(
            ChannelPool channelPool,
            Microservice microservice,
            EventCodec codec,
            AuditHandlerRegistry handlerRegistry,
            int concurrency,
            Clock clock) {
        super(channelPool, microservice, QueueNames.auditQueue(microservice), concurrency);
        this.codec = codec;
        this.handlerRegistry = handlerRegistry;
        this.clock = clock;
    }

    @Override
    protected Disposition process(Delivery delivery, Settlement settlement) {
        String rawKind = delivery.eventKindHeader().orElse(MessageHeaders.UNKNOWN);
        Optional<EventKind> resolved = EventKind.fromValue(rawKind).filter(EventKind::isAudit);

        if (resolved.isEmpty()) {
            log.warn("Rejecting non-audit message {} on {} (event={})",
                delivery.deliveryTag(), queueName(), rawKind);
            settle(() -> settlement.nack(false), delivery);
            return Disposition.DEAD_LETTERED;
        }

        EventKind kind = resolved.get();
        if (!handlerRegistry.hasHandler(kind)) {
            log.debug("No audit handler for {}, acking", kind);
            settle(settlement::ack, delivery);
            return Disposition.ACKED;
        }

        try {
            AuditPayload record = (AuditPayload) codec.decode(kind, delivery.body());
            handlerRegistry.dispatch(record, new AuditContext(kind, microservice(), queueName(), clock.instant()));
        } catch (Exception e) {
            log.error("Audit handler failed for {} on {}, discarding record: {}",
                kind, queueName(), e.getMessage());
            settle(() -> settlement.nack(false), delivery);
            return Disposition.DEAD_LETTERED;
        }

        settle(settlement::ack, delivery);
        log.debug("Consumed {} on {}", kind, queueName());
        return Disposition.ACKED;
    }
}
