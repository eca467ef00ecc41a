package com.ivamare.eventbus.broker.impl;

import com.ivamare.eventbus.broker.BrokerChannel;
import com.ivamare.eventbus.broker.DeliveryListener;
import com.ivamare.eventbus.broker.ExchangeType;
import com.ivamare.eventbus.broker.OutboundMessage;
import com.ivamare.eventbus.exception.BrokerException;
import com.ivamare.eventbus.model.Delivery;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.LongString;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link BrokerChannel} backed by a RabbitMQ client channel.
 */
public class RabbitBrokerChannel implements BrokerChannel {

    private static final Logger log = LoggerFactory.getLogger(RabbitBrokerChannel.class);

    private static final int PERSISTENT = 2;

    private final Channel channel;

    public RabbitBrokerChannel(Channel channel) {
        this.channel = channel;
    }

    @Override
    public void declareExchange(String exchange, ExchangeType type) {
        execute("declare exchange " + exchange,
            () -> channel.exchangeDeclare(exchange, type.getValue(), true));
    }

    @Override
    public void declareQueue(String queue, Map<String, Object> arguments) {
        execute("declare queue " + queue,
            () -> channel.queueDeclare(queue, true, false, false, arguments));
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey, Map<String, Object> arguments) {
        execute("bind " + queue + " to " + exchange,
            () -> channel.queueBind(queue, exchange, routingKey, arguments));
    }

    @Override
    public void unbindQueue(String queue, String exchange, String routingKey, Map<String, Object> arguments) {
        execute("unbind " + queue + " from " + exchange,
            () -> channel.queueUnbind(queue, exchange, routingKey, arguments));
    }

    @Override
    public void publish(String exchange, String routingKey, OutboundMessage message) {
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
            .contentType(OutboundMessage.CONTENT_TYPE)
            .deliveryMode(PERSISTENT)
            .headers(new HashMap<>(message.headers()))
            .messageId(message.messageId())
            .appId(message.appId())
            .type(message.type())
            .timestamp(message.timestamp() != null ? Date.from(message.timestamp()) : null)
            .expiration(message.expiration())
            .build();

        execute("publish to " + (exchange.isEmpty() ? routingKey : exchange),
            () -> channel.basicPublish(exchange, routingKey, properties, message.body()));
    }

    @Override
    public void prefetch(int count) {
        execute("set prefetch", () -> channel.basicQos(count));
    }

    @Override
    public String consume(String queue, DeliveryListener listener) {
        try {
            return channel.basicConsume(
                queue,
                false,
                (consumerTag, message) -> listener.onDelivery(toDelivery(message.getEnvelope(),
                    message.getProperties(), message.getBody())),
                consumerTag -> listener.onTerminated(consumerTag, "cancelled by broker"),
                (consumerTag, signal) -> listener.onTerminated(consumerTag, signal.getMessage())
            );
        } catch (IOException | ShutdownSignalException e) {
            throw new BrokerException("Failed to consume from " + queue, e);
        }
    }

    @Override
    public void cancel(String consumerTag) {
        execute("cancel consumer " + consumerTag, () -> channel.basicCancel(consumerTag));
    }

    @Override
    public void ack(long deliveryTag) {
        execute("ack delivery " + deliveryTag, () -> channel.basicAck(deliveryTag, false));
    }

    @Override
    public void nack(long deliveryTag, boolean requeue) {
        execute("nack delivery " + deliveryTag, () -> channel.basicNack(deliveryTag, false, requeue));
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            log.debug("Channel {} already closing: {}", channel.getChannelNumber(), e.getMessage());
        }
    }

    static Delivery toDelivery(Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        Date timestamp = properties.getTimestamp();
        return new Delivery(
            envelope.getDeliveryTag(),
            envelope.getExchange(),
            envelope.getRoutingKey(),
            envelope.isRedeliver(),
            decodeHeaders(properties.getHeaders()),
            properties.getMessageId(),
            properties.getAppId(),
            timestamp != null ? timestamp.toInstant() : null,
            body
        );
    }

    private static Map<String, Object> decodeHeaders(Map<String, Object> headers) {
        Map<String, Object> decoded = new HashMap<>();
        if (headers == null) {
            return decoded;
        }
        headers.forEach((key, value) -> {
            if (value != null) {
                decoded.put(key, decodeValue(value));
            }
        });
        return decoded;
    }

    private static Object decodeValue(Object value) {
        if (value instanceof LongString longString) {
            return longString.toString();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(RabbitBrokerChannel::decodeValue).toList();
        }
        return value;
    }

    private void execute(String action, ChannelAction operation) {
        try {
            operation.run();
        } catch (IOException | ShutdownSignalException e) {
            throw new BrokerException("Failed to " + action, e);
        }
    }

    @FunctionalInterface
    private interface ChannelAction {
        void run() throws IOException;
    }
}
