package com.ivamare.eventbus.broker;

import java.util.Map;

/**
 * A single AMQP channel.
 *
 * <p>Channels are not safe for concurrent publishing. Consumers get their own channel so that
 * flow control and delivery tags stay scoped to one queue.
 *
 * <p>All methods raise {@link com.ivamare.eventbus.exception.BrokerException} on transport
 * failure.
 */
public interface BrokerChannel extends AutoCloseable {

    /**
     * Declare a durable exchange. Idempotent.
     */
    void declareExchange(String exchange, ExchangeType type);

    /**
     * Declare a durable, non-exclusive queue. Idempotent for identical arguments.
     */
    void declareQueue(String queue, Map<String, Object> arguments);

    void bindQueue(String queue, String exchange, String routingKey, Map<String, Object> arguments);

    void unbindQueue(String queue, String exchange, String routingKey, Map<String, Object> arguments);

    /**
     * Publish a persistent message.
     *
     * @param exchange target exchange, empty string for the default exchange
     * @param routingKey routing key
     * @param message message with its properties
     */
    void publish(String exchange, String routingKey, OutboundMessage message);

    /**
     * Limit the number of unacknowledged deliveries on this channel.
     */
    void prefetch(int count);

    /**
     * Start consuming with manual acknowledgement.
     *
     * @return the consumer tag
     */
    String consume(String queue, DeliveryListener listener);

    void cancel(String consumerTag);

    void ack(long deliveryTag);

    void nack(long deliveryTag, boolean requeue);

    boolean isOpen();

    @Override
    void close();
}
