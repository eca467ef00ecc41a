package com.ivamare.eventbus;

import com.ivamare.eventbus.audit.AuditEmitter;
import com.ivamare.eventbus.audit.AuditHandlerRegistry;
import com.ivamare.eventbus.broker.ChannelPool;
import com.ivamare.eventbus.codec.EventCodec;
import com.ivamare.eventbus.handler.HandlerRegistry;
import com.ivamare.eventbus.health.WorkerHealthIndicator;
import com.ivamare.eventbus.model.EventKind;
import com.ivamare.eventbus.model.Microservice;
import com.ivamare.eventbus.topology.QueueConsumerProps;
import com.ivamare.eventbus.topology.Topology;
import com.ivamare.eventbus.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Auto-start configuration for workers.
 *
 * <p>Enable with:
 * <pre>
 * eventbus:
 *   worker:
 *     auto-start: true
 * </pre>
 *
 * <p>When the application is ready the topology is declared (a failure aborts startup),
 * then one worker is started per configured consumer, plus an audit worker when
 * {@code eventbus.audit.consume} is set.
 */
@AutoConfiguration(after = EventBusAutoConfiguration.class)
@ConditionalOnProperty(prefix = "eventbus.worker", name = "auto-start", havingValue = "true")
public class WorkerAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WorkerAutoStartConfiguration.class);

    private final List<Worker> workers = new ArrayList<>();
    private final ChannelPool channelPool;
    private final Topology topology;
    private final EventCodec codec;
    private final HandlerRegistry handlerRegistry;
    private final AuditHandlerRegistry auditHandlerRegistry;
    private final AuditEmitter auditEmitter;
    private final EventBusProperties properties;

    public WorkerAutoStartConfiguration(
            ChannelPool channelPool,
            Topology topology,
            EventCodec codec,
            HandlerRegistry handlerRegistry,
            AuditHandlerRegistry auditHandlerRegistry,
            AuditEmitter auditEmitter,
            EventBusProperties properties) {
        this.channelPool = channelPool;
        this.topology = topology;
        this.codec = codec;
        this.handlerRegistry = handlerRegistry;
        this.auditHandlerRegistry = auditHandlerRegistry;
        this.auditEmitter = auditEmitter;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startWorkers() {
        List<QueueConsumerProps> consumers = properties.consumerProps();
        boolean consumeAudit = properties.getAudit().isConsume();

        if (consumers.isEmpty() && !consumeAudit) {
            log.warn("No consumers configured, no workers to start");
            return;
        }

        // Declaration failures propagate and abort startup
        topology.declare(consumers);

        for (QueueConsumerProps consumer : consumers) {
            Set<EventKind> unhandled = consumer.events().stream()
                .filter(kind -> !handlerRegistry.hasHandler(kind))
                .collect(Collectors.toSet());
            if (!unhandled.isEmpty()) {
                log.warn("Queue {} subscribes to {} without handlers; those events will be dead-lettered",
                    consumer.queueName(), unhandled);
            }

            Worker worker = Worker.builder()
                .channelPool(channelPool)
                .codec(codec)
                .consumer(consumer)
                .handlerRegistry(handlerRegistry)
                .auditEmitter(auditEmitter)
                .retryPolicy(properties.retryPolicyFor(consumer.microservice()))
                .concurrency(properties.concurrencyFor(consumer.microservice()))
                .build();

            worker.start();
            workers.add(worker);

            log.info("Started worker for queue={}", consumer.queueName());
        }

        if (consumeAudit) {
            Microservice microservice = properties.requireMicroservice();
            topology.declareAudit(microservice);

            Worker auditWorker = Worker.auditBuilder()
                .channelPool(channelPool)
                .codec(codec)
                .microservice(microservice)
                .handlerRegistry(auditHandlerRegistry)
                .concurrency(properties.getAudit().getConcurrency())
                .build();

            auditWorker.start();
            workers.add(auditWorker);

            log.info("Started audit worker for queue={}", auditWorker.queueName());
        }
    }

    @PreDestroy
    public void stopWorkers() {
        if (workers.isEmpty()) {
            return;
        }

        Duration timeout = properties.getWorker().getShutdownTimeout();
        log.info("Stopping {} workers...", workers.size());

        workers.stream()
            .map(w -> w.stop(timeout))
            .toList()
            .forEach(future -> future.join());

        log.info("All workers stopped");
    }

    @Bean
    public List<Worker> eventBusWorkers() {
        return workers;
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class WorkerHealthConfiguration {

        @Bean
        public HealthIndicator workerHealthIndicator(WorkerAutoStartConfiguration autoStart) {
            return new WorkerHealthIndicator(autoStart.workers);
        }
    }
}
