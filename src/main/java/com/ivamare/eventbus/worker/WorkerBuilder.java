package com.ivamare.eventbus.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventbus.audit.AuditEmitter;
import com.ivamare.eventbus.broker.ChannelPool;
import com.ivamare.eventbus.codec.EventCodec;
import com.ivamare.eventbus.handler.HandlerRegistry;
import com.ivamare.eventbus.policy.RetryPolicy;
import com.ivamare.eventbus.topology.QueueConsumerProps;
import com.ivamare.eventbus.worker.impl.EventWorker;

import java.time.Clock;

/**
 * Builder for business event workers.
 */
public class WorkerBuilder {

    private ChannelPool channelPool;
    private EventCodec codec;
    private QueueConsumerProps consumer;
    private HandlerRegistry handlerRegistry;
    private AuditEmitter auditEmitter;
    private RetryPolicy retryPolicy;
    private int concurrency = 1;
    private Clock clock = Clock.systemUTC();

    /**
     * Set the channel pool the worker opens its consumer channel from and publishes retries on.
     *
     * @param channelPool The channel pool
     * @return this builder
     */
    public WorkerBuilder channelPool(ChannelPool channelPool) {
        this.channelPool = channelPool;
        return this;
    }

    /**
     * Set the codec for payload decoding.
     *
     * @param codec The codec
     * @return this builder
     */
    public WorkerBuilder codec(EventCodec codec) {
        this.codec = codec;
        return this;
    }

    /**
     * Use a codec over the given ObjectMapper.
     *
     * @param objectMapper The object mapper
     * @return this builder
     */
    public WorkerBuilder objectMapper(ObjectMapper objectMapper) {
        this.codec = new EventCodec(objectMapper);
        return this;
    }

    /**
     * Set the consumer whose queue is processed.
     *
     * @param consumer The consumer props
     * @return this builder
     */
    public WorkerBuilder consumer(QueueConsumerProps consumer) {
        this.consumer = consumer;
        return this;
    }

    /**
     * Set the handler registry.
     *
     * @param handlerRegistry The handler registry
     * @return this builder
     */
    public WorkerBuilder handlerRegistry(HandlerRegistry handlerRegistry) {
        this.handlerRegistry = handlerRegistry;
        return this;
    }

    /**
     * Set the audit emitter used for received, processed and dead-letter records.
     *
     * @param auditEmitter The audit emitter
     * @return this builder
     */
    public WorkerBuilder auditEmitter(AuditEmitter auditEmitter) {
        this.auditEmitter = auditEmitter;
        return this;
    }

    /**
     * Set the retry policy (default: fibonacci backoff in seconds, 3 retries).
     *
     * @param retryPolicy The retry policy
     * @return this builder
     */
    public WorkerBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
        return this;
    }

    /**
     * Set the concurrency level (default: 1, which keeps deliveries in queue order).
     *
     * @param concurrency Number of concurrent handlers
     * @return this builder
     */
    public WorkerBuilder concurrency(int concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    public WorkerBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Build the worker instance.
     *
     * @return configured Worker
     * @throws IllegalStateException if required properties not set
     */
    public Worker build() {
        if (channelPool == null) {
            throw new IllegalStateException("channelPool is required");
        }
        if (consumer == null) {
            throw new IllegalStateException("consumer is required");
        }
        if (handlerRegistry == null) {
            throw new IllegalStateException("handlerRegistry is required");
        }
        if (auditEmitter == null) {
            throw new IllegalStateException("auditEmitter is required");
        }
        if (concurrency < 1) {
            throw new IllegalStateException("concurrency must be at least 1");
        }

        if (codec == null) {
            codec = new EventCodec(new ObjectMapper().findAndRegisterModules());
        }

        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.defaultPolicy();
        }

        return new EventWorker(
            channelPool,
            consumer,
            codec,
            handlerRegistry,
            auditEmitter,
            retryPolicy,
            concurrency,
            clock
        );
    }
}
