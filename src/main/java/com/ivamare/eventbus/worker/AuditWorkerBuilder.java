package com.ivamare.eventbus.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventbus.audit.AuditHandlerRegistry;
import com.ivamare.eventbus.broker.ChannelPool;
import com.ivamare.eventbus.codec.EventCodec;
import com.ivamare.eventbus.model.Microservice;
import com.ivamare.eventbus.worker.impl.AuditWorker;

import java.time.Clock;

/**
 * Builder for audit workers.
 *
 * <p>An audit worker takes no publisher and no audit emitter.
 */
public class AuditWorkerBuilder {

    private ChannelPool channelPool;
    private EventCodec codec;
    private Microservice microservice;
    private AuditHandlerRegistry handlerRegistry;
    private int concurrency = 1;
    private Clock clock = Clock.systemUTC();

    public AuditWorkerBuilder channelPool(ChannelPool channelPool) {
        this.channelPool = channelPool;
        return this;
    }

    public AuditWorkerBuilder codec(EventCodec codec) {
        this.codec = codec;
        return this;
    }

    /**
     * Set the microservice whose audit queue is consumed.
     *
     * @param microservice The microservice
     * @return this builder
     */
    public AuditWorkerBuilder microservice(Microservice microservice) {
        this.microservice = microservice;
        return this;
    }

    public AuditWorkerBuilder handlerRegistry(AuditHandlerRegistry handlerRegistry) {
        this.handlerRegistry = handlerRegistry;
        return this;
    }

    public AuditWorkerBuilder concurrency(int concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    public AuditWorkerBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * @return configured audit Worker
     * @throws IllegalStateException if required properties not set
     */
    public Worker build() {
        if (channelPool == null) {
            throw new IllegalStateException("channelPool is required");
        }
        if (microservice == null) {
            throw new IllegalStateException("microservice is required");
        }
        if (handlerRegistry == null) {
            throw new IllegalStateException("handlerRegistry is required");
        }
        if (concurrency < 1) {
            throw new IllegalStateException("concurrency must be at least 1");
        }
        if (codec == null) {
            codec = new EventCodec(new ObjectMapper().findAndRegisterModules());
        }
        return new AuditWorker(channelPool, microservice, codec, handlerRegistry, concurrency, clock);
    }
}
