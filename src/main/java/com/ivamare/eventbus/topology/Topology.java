package com.ivamare.eventbus.topology;

import com.ivamare.eventbus.broker.BrokerChannel;
import com.ivamare.eventbus.broker.ChannelPool;
import com.ivamare.eventbus.broker.ExchangeType;
import com.ivamare.eventbus.exception.BrokerException;
import com.ivamare.eventbus.exception.TopologyException;
import com.ivamare.eventbus.model.EventKind;
import com.ivamare.eventbus.model.MessageHeaders;
import com.ivamare.eventbus.model.Microservice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;

/**
 * Declares exchanges, queues and bindings.
 *
 * <p>Every declaration is idempotent, so the whole topology is declared again on each start.
 * Any failure raises {@link TopologyException}; callers must not start publishing or consuming
 * after one.
 *
 * <p>Per consumer the layout is:
 * <pre>
 * matching_exchange (headers) --[x-match=all, event-kind=K]--> {micro}__events
 * {micro}__events  --nack(requeue=false)--> dead_letter_exchange --> {micro}__dead_letter
 * {micro}__requeue --TTL expiry--> default exchange --> {micro}__events
 * audit_exchange (direct) --[{micro}]--> {micro}__audit
 * </pre>
 */
public class Topology {

    private static final Logger log = LoggerFactory.getLogger(Topology.class);

    static final String DEAD_LETTER_EXCHANGE_ARG = "x-dead-letter-exchange";
    static final String DEAD_LETTER_ROUTING_KEY_ARG = "x-dead-letter-routing-key";

    private final ChannelPool channelPool;

    public Topology(ChannelPool channelPool) {
        this.channelPool = channelPool;
    }

    /**
     * Declare the shared exchanges and the queues of every consumer.
     *
     * @param consumers consumers to declare queues for
     * @throws TopologyException if any declaration fails
     */
    public void declare(Collection<QueueConsumerProps> consumers) {
        try (BrokerChannel channel = openChannel()) {
            declareExchanges(channel);
            for (QueueConsumerProps consumer : consumers) {
                declareConsumer(channel, consumer);
            }
        }
        log.info("Declared topology for {} consumer(s)", consumers.size());
    }

    /**
     * Declare only the audit side for a microservice, for processes that consume audit
     * records without owning a business queue.
     *
     * @param microservice owner of the audit queue
     * @throws TopologyException if any declaration fails
     */
    public void declareAudit(Microservice microservice) {
        try (BrokerChannel channel = openChannel()) {
            declareExchanges(channel);
            declareAuditQueue(channel, microservice);
        }
    }

    /**
     * Headers a business queue binding matches on.
     *
     * @param kind subscribed event kind
     * @return binding arguments
     */
    public static Map<String, Object> bindingArguments(EventKind kind) {
        return Map.of(
            MessageHeaders.X_MATCH, "all",
            MessageHeaders.EVENT_KIND, kind.getValue()
        );
    }

    private BrokerChannel openChannel() {
        try {
            return channelPool.openChannel();
        } catch (BrokerException e) {
            throw new TopologyException("topology channel", e);
        }
    }

    private void declareExchanges(BrokerChannel channel) {
        declare(QueueNames.MATCHING_EXCHANGE,
            () -> channel.declareExchange(QueueNames.MATCHING_EXCHANGE, ExchangeType.HEADERS));
        declare(QueueNames.AUDIT_EXCHANGE,
            () -> channel.declareExchange(QueueNames.AUDIT_EXCHANGE, ExchangeType.DIRECT));
        declare(QueueNames.DEAD_LETTER_EXCHANGE,
            () -> channel.declareExchange(QueueNames.DEAD_LETTER_EXCHANGE, ExchangeType.DIRECT));
    }

    private void declareConsumer(BrokerChannel channel, QueueConsumerProps consumer) {
        String queue = consumer.queueName();
        String deadLetterQueue = consumer.deadLetterQueueName();
        String requeueQueue = consumer.requeueQueueName();

        declare(queue, () -> channel.declareQueue(queue, Map.of(
            DEAD_LETTER_EXCHANGE_ARG, QueueNames.DEAD_LETTER_EXCHANGE,
            DEAD_LETTER_ROUTING_KEY_ARG, queue
        )));

        declare(deadLetterQueue, () -> {
            channel.declareQueue(deadLetterQueue, Map.of());
            channel.bindQueue(deadLetterQueue, QueueNames.DEAD_LETTER_EXCHANGE, queue, Map.of());
        });

        declare(requeueQueue, () -> channel.declareQueue(requeueQueue, Map.of(
            DEAD_LETTER_EXCHANGE_ARG, QueueNames.DEFAULT_EXCHANGE,
            DEAD_LETTER_ROUTING_KEY_ARG, queue
        )));

        for (EventKind kind : EventKind.values()) {
            if (kind.isAudit()) {
                continue;
            }
            Map<String, Object> arguments = bindingArguments(kind);
            if (consumer.subscribes(kind)) {
                declare(queue + " binding " + kind, () ->
                    channel.bindQueue(queue, QueueNames.MATCHING_EXCHANGE, "", arguments));
            } else {
                declare(queue + " unbinding " + kind, () ->
                    channel.unbindQueue(queue, QueueNames.MATCHING_EXCHANGE, "", arguments));
            }
        }

        declareAuditQueue(channel, consumer.microservice());

        log.info("Declared queue {} for events {}", queue, consumer.events());
    }

    private void declareAuditQueue(BrokerChannel channel, Microservice microservice) {
        String auditQueue = QueueNames.auditQueue(microservice);
        declare(auditQueue, () -> {
            channel.declareQueue(auditQueue, Map.of());
            channel.bindQueue(auditQueue, QueueNames.AUDIT_EXCHANGE,
                QueueNames.auditRoutingKey(microservice), Map.of());
        });
    }

    private void declare(String resource, Runnable declaration) {
        try {
            declaration.run();
        } catch (BrokerException e) {
            throw new TopologyException(resource, e);
        }
    }
}
