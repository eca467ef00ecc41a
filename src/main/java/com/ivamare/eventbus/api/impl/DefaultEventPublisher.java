package com.ivamare.eventbus.api.impl;

import com.ivamare.eventbus.api.EventPublisher;
import com.ivamare.eventbus.broker.ChannelPool;
import com.ivamare.eventbus.broker.OutboundMessage;
import com.ivamare.eventbus.codec.EventCodec;
import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventKind;
import com.ivamare.eventbus.model.MessageHeaders;
import com.ivamare.eventbus.model.Microservice;
import com.ivamare.eventbus.topology.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Default implementation of EventPublisher.
 */
public class DefaultEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventPublisher.class);

    private final ChannelPool channelPool;
    private final EventCodec codec;
    private final Microservice microservice;
    private final Clock clock;

    /**
     * @param channelPool Owner of the publish channel
     * @param codec Payload serializer
     * @param microservice Identity stamped as app id on published events
     */
    public DefaultEventPublisher(ChannelPool channelPool, EventCodec codec, Microservice microservice) {
        this(channelPool, codec, microservice, Clock.systemUTC());
    }

    public DefaultEventPublisher(ChannelPool channelPool, EventCodec codec,
                                 Microservice microservice, Clock clock) {
        this.channelPool = channelPool;
        this.codec = codec;
        this.microservice = microservice;
        this.clock = clock;
    }

    @Override
    public String publish(BusinessEvent payload) {
        return publish(payload.eventKind(), payload);
    }

    @Override
    public String publish(EventKind kind, BusinessEvent payload) {
        if (kind.isAudit()) {
            throw new IllegalArgumentException("Audit event " + kind + " cannot be published directly");
        }
        if (!kind.getPayloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Payload " + payload.getClass().getSimpleName()
                + " does not belong to event " + kind);
        }

        byte[] body = codec.encode(payload);
        String messageId = UUID.randomUUID().toString();

        OutboundMessage message = new OutboundMessage(
            body,
            Map.of(MessageHeaders.EVENT_KIND, kind.getValue()),
            messageId,
            microservice.getValue(),
            clock.instant(),
            null,
            kind.getValue()
        );

        channelPool.publish(QueueNames.MATCHING_EXCHANGE, "", message);

        log.debug("Published {} (eventId={}) from {}", kind, messageId, microservice);
        return messageId;
    }

    @Override
    public String commenceSaga(BusinessEvent firstStep) {
        String messageId = publish(firstStep);
        log.info("Commenced saga with {} (eventId={})", firstStep.eventKind(), messageId);
        return messageId;
    }
}
