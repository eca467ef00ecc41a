package com.ivamare.eventbus.worker;

import com.ivamare.eventbus.model.Microservice;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Consumer of one queue.
 *
 * <p>Business workers run every delivery through the audited pipeline (received audit,
 * handler, processed or dead-letter audit, disposition). Audit workers consume a
 * microservice's audit queue and never emit audit records themselves.
 *
 * <p>Example:
 * <pre>
 * Worker worker = Worker.builder()
 *     .channelPool(channelPool)
 *     .consumer(QueueConsumerProps.of(Microservice.PAYMENTS, EventKind.PAYMENT_REQUESTED))
 *     .handlerRegistry(registry)
 *     .auditEmitter(auditEmitter)
 *     .retryPolicy(RetryPolicy.fibonacci(Duration.ofSeconds(1), 3))
 *     .build();
 *
 * worker.start();
 * // ... later
 * worker.stop(Duration.ofSeconds(30));
 * </pre>
 */
public interface Worker {

    /**
     * Start consuming.
     *
     * @throws com.ivamare.eventbus.exception.BrokerException if the consumer cannot be registered
     */
    void start();

    /**
     * Stop the worker gracefully.
     *
     * <p>Stops accepting new deliveries and waits for in-flight ones to reach their
     * disposition within the specified timeout, then closes the channel.
     *
     * @param timeout Maximum time to wait for in-flight deliveries
     * @return Future that completes when worker has stopped
     */
    CompletableFuture<Void> stop(Duration timeout);

    /**
     * Stop the worker immediately without waiting.
     */
    void stopNow();

    /**
     * @return true if worker is accepting and processing deliveries
     */
    boolean isRunning();

    /**
     * @return count of deliveries currently being processed
     */
    int inFlightCount();

    /**
     * @return the consumed queue
     */
    String queueName();

    /**
     * @return the microservice owning the queue
     */
    Microservice microservice();

    /**
     * Get consecutive broker error count for health monitoring.
     *
     * @return number of consecutive transport errors, 0 after a successful settlement
     */
    int getConsecutiveErrorCount();

    /**
     * Create a builder for a business event worker.
     *
     * @return new builder instance
     */
    static WorkerBuilder builder() {
        return new WorkerBuilder();
    }

    /**
     * Create a builder for an audit worker.
     *
     * @return new builder instance
     */
    static AuditWorkerBuilder auditBuilder() {
        return new AuditWorkerBuilder();
    }
}
