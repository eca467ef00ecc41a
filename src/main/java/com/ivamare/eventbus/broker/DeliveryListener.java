package com.ivamare.eventbus.broker;

import com.ivamare.eventbus.model.Delivery;

/**
 * Callbacks for a consumer registered on a {@link BrokerChannel}.
 */
public interface DeliveryListener {

    /**
     * Called for every message delivered to the consumer.
     *
     * @param delivery the delivered message
     */
    void onDelivery(Delivery delivery);

    /**
     * Called when the consumer can no longer receive messages, either because the broker
     * cancelled it or because its channel shut down.
     *
     * @param consumerTag tag of the consumer
     * @param reason human readable reason
     */
    default void onTerminated(String consumerTag, String reason) {
    }
}
