package com.ivamare.eventbus.broker.impl;

import com.ivamare.eventbus.broker.BrokerChannel;
import com.ivamare.eventbus.broker.ChannelPool;
import com.ivamare.eventbus.broker.OutboundMessage;
import com.ivamare.eventbus.exception.BrokerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link ChannelPool} on top of a Spring AMQP {@link ConnectionFactory}.
 *
 * <p>The connection factory keeps the single broker connection (and recovers it); this pool
 * hands out one channel per consumer and keeps one lazily opened channel for publishing.
 */
public class RabbitChannelPool implements ChannelPool {

    private static final Logger log = LoggerFactory.getLogger(RabbitChannelPool.class);

    private final ConnectionFactory connectionFactory;
    private final ReentrantLock publishLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private BrokerChannel publishChannel;

    public RabbitChannelPool(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    @Override
    public BrokerChannel openChannel() {
        if (closed.get()) {
            throw new BrokerException("Channel pool is closed");
        }
        try {
            Connection connection = connectionFactory.createConnection();
            return new RabbitBrokerChannel(connection.createChannel(false));
        } catch (AmqpException e) {
            throw new BrokerException("Failed to open channel to " + connectionFactory.getHost(), e);
        }
    }

    @Override
    public void publish(String exchange, String routingKey, OutboundMessage message) {
        publishLock.lock();
        try {
            if (publishChannel == null || !publishChannel.isOpen()) {
                publishChannel = openChannel();
                log.debug("Opened publish channel");
            }
            publishChannel.publish(exchange, routingKey, message);
        } catch (BrokerException e) {
            discardPublishChannel();
            throw e;
        } finally {
            publishLock.unlock();
        }
    }

    @Override
    public boolean isOpen() {
        if (closed.get()) {
            return false;
        }
        try {
            return connectionFactory.createConnection().isOpen();
        } catch (AmqpException e) {
            log.debug("Broker connection unavailable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        publishLock.lock();
        try {
            discardPublishChannel();
        } finally {
            publishLock.unlock();
        }
        log.info("Channel pool closed");
    }

    private void discardPublishChannel() {
        if (publishChannel != null) {
            publishChannel.close();
            publishChannel = null;
        }
    }
}
