package com.ivamare.eventbus.worker.impl;

import com.ivamare.eventbus.broker.BrokerChannel;
import com.ivamare.eventbus.exception.InvalidOperationException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Acknowledgement handle of one delivery. Allows exactly one ack or nack.
 *
 * <p>The handle is marked settled before the broker call, so a transport failure during the
 * call never leads to a second attempt on the same delivery tag.
 */
final class Settlement {

    private final BrokerChannel channel;
    private final long deliveryTag;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    Settlement(BrokerChannel channel, long deliveryTag) {
        this.channel = channel;
        this.deliveryTag = deliveryTag;
    }

    void ack() {
        markSettled("ack");
        channel.ack(deliveryTag);
    }

    void nack(boolean requeue) {
        markSettled(requeue ? "nack with requeue" : "nack");
        channel.nack(deliveryTag, requeue);
    }

    boolean isSettled() {
        return settled.get();
    }

    long deliveryTag() {
        return deliveryTag;
    }

    private void markSettled(String operation) {
        if (!settled.compareAndSet(false, true)) {
            throw new InvalidOperationException(
                "Cannot " + operation + " delivery " + deliveryTag + ": already settled");
        }
    }
}
