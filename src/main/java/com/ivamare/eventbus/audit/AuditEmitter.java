package com.ivamare.eventbus.audit;

import com.ivamare.eventbus.broker.ChannelPool;
import com.ivamare.eventbus.broker.OutboundMessage;
import com.ivamare.eventbus.codec.EventCodec;
import com.ivamare.eventbus.model.AuditDeadLetter;
import com.ivamare.eventbus.model.AuditPayload;
import com.ivamare.eventbus.model.AuditProcessed;
import com.ivamare.eventbus.model.AuditReceived;
import com.ivamare.eventbus.model.Delivery;
import com.ivamare.eventbus.model.MessageHeaders;
import com.ivamare.eventbus.model.Microservice;
import com.ivamare.eventbus.topology.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Publishes the audit trail of business deliveries to the audit exchange.
 *
 * <p>Emission is best effort. A failed audit publish is logged and swallowed so that the
 * disposition of the audited delivery never depends on the audit path. Calls are synchronous,
 * which keeps the records of one delivery in order (received, then processed or dead-letter).
 */
public class AuditEmitter {

    private static final Logger log = LoggerFactory.getLogger(AuditEmitter.class);

    private final ChannelPool channelPool;
    private final EventCodec codec;
    private final AuditOptions options;
    private final Clock clock;

    public AuditEmitter(ChannelPool channelPool, EventCodec codec, AuditOptions options) {
        this(channelPool, codec, options, Clock.systemUTC());
    }

    public AuditEmitter(ChannelPool channelPool, EventCodec codec, AuditOptions options, Clock clock) {
        this.channelPool = channelPool;
        this.codec = codec;
        this.options = options;
        this.clock = clock;
    }

    public AuditOptions options() {
        return options;
    }

    /**
     * Record that a delivery was received, before its handler runs.
     *
     * @return true if the record was published
     */
    public boolean received(Microservice microservice, String queueName, String eventKind, Delivery delivery) {
        AuditOptions.CapturedPayload captured = options.capture(delivery.body());
        return emit(microservice, new AuditReceived(
            delivery.publisher(),
            microservice.getValue(),
            eventKind,
            now(),
            queueName,
            delivery.eventId(),
            captured.text(),
            captured.truncated()
        ));
    }

    /**
     * Record that a handler completed, before the delivery is acked.
     *
     * @return true if the record was published
     */
    public boolean processed(Microservice microservice, String queueName, String eventKind, Delivery delivery) {
        return emit(microservice, new AuditProcessed(
            delivery.publisher(),
            microservice.getValue(),
            eventKind,
            now(),
            queueName,
            delivery.eventId()
        ));
    }

    /**
     * Record that a delivery is given up on, before it is nacked to the dead-letter queue.
     *
     * @return true if the record was published
     */
    public boolean deadLetter(Microservice microservice, String queueName, String eventKind,
                              Delivery delivery, String reason, int attempts) {
        AuditOptions.CapturedPayload captured = options.capture(delivery.body());
        return emit(microservice, new AuditDeadLetter(
            delivery.publisher(),
            microservice.getValue(),
            eventKind,
            now(),
            queueName,
            reason,
            attempts,
            delivery.eventId(),
            captured.text(),
            captured.truncated()
        ));
    }

    private boolean emit(Microservice microservice, AuditPayload record) {
        if (!options.enabled()) {
            return false;
        }
        try {
            OutboundMessage message = new OutboundMessage(
                codec.encode(record),
                Map.of(MessageHeaders.EVENT_KIND, record.eventKind().getValue()),
                UUID.randomUUID().toString(),
                microservice.getValue(),
                record.occurredAt(),
                null,
                record.eventKind().getValue()
            );
            channelPool.publish(QueueNames.AUDIT_EXCHANGE, QueueNames.auditRoutingKey(microservice), message);
            log.debug("Emitted {} for {} (eventId={})",
                record.eventKind(), record.auditedEvent(), record.eventId());
            return true;
        } catch (Exception e) {
            log.warn("Failed to emit {} for {} (eventId={}): {}",
                record.eventKind(), record.auditedEvent(), record.eventId(), e.getMessage());
            return false;
        }
    }

    private Instant now() {
        return clock.instant();
    }
}
