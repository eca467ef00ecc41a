package com.ivamare.eventbus.broker;

/**
 * Owner of the broker connection.
 *
 * <p>An instance is created once and passed to the publisher, the audit emitter, the topology
 * declarer and the workers. Nothing in the bus holds connection state outside of it, so
 * several pools (for example against different virtual hosts) can live in one process.
 */
public interface ChannelPool extends AutoCloseable {

    /**
     * Open a dedicated channel. The caller owns it and must close it.
     *
     * @return a new channel
     */
    BrokerChannel openChannel();

    /**
     * Publish on the shared publish channel. Concurrent callers are serialized so that only
     * one publish is in flight on that channel at a time.
     *
     * @param exchange target exchange, empty string for the default exchange
     * @param routingKey routing key
     * @param message the message
     */
    void publish(String exchange, String routingKey, OutboundMessage message);

    /**
     * @return true while the underlying connection is usable
     */
    boolean isOpen();

    @Override
    void close();
}
