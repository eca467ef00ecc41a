package com.ivamare.eventbus.worker.impl;

import com.ivamare.eventbus.broker.BrokerChannel;
import com.ivamare.eventbus.broker.ChannelPool;
import com.ivamare.eventbus.broker.DeliveryListener;
import com.ivamare.eventbus.exception.BrokerException;
import com.ivamare.eventbus.model.Delivery;
import com.ivamare.eventbus.model.Disposition;
import com.ivamare.eventbus.model.Microservice;
import com.ivamare.eventbus.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumer loop shared by business and audit workers.
 *
 * <p>Owns one channel with a prefetch equal to the concurrency, so at most {@code concurrency}
 * deliveries are in flight. With the default concurrency of one, deliveries are handled in
 * broker order.
 */
abstract class AbstractQueueWorker implements Worker, DeliveryListener {

    private static final Logger log = LoggerFactory.getLogger(AbstractQueueWorker.class);

    private final ChannelPool channelPool;
    private final Microservice microservice;
    private final String queueName;
    private final int concurrency;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicInteger inFlightCount = new AtomicInteger(0);
    private final AtomicInteger consecutiveErrors = new AtomicInteger(0);

    private volatile ExecutorService executor;
    private volatile BrokerChannel channel;
    private volatile String consumerTag;

    protected AbstractQueueWorker(ChannelPool channelPool, Microservice microservice,
                                  String queueName, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        this.channelPool = channelPool;
        this.microservice = microservice;
        this.queueName = queueName;
        this.concurrency = concurrency;
    }

    /**
     * Run one delivery to its disposition. Implementations must settle the delivery exactly
     * once and must not throw for handler failures. A delivery left unsettled by an unexpected
     * exception is rejected without requeue, so it cannot hold the prefetch window.
     */
    protected abstract Disposition process(Delivery delivery, Settlement settlement);

    @Override
    public void start() {
        if (running.getAndSet(true)) {
            log.warn("Worker for {} already running", queueName);
            return;
        }

        stopping.set(false);
        executor = Executors.newFixedThreadPool(concurrency, threadFactory());

        try {
            channel = channelPool.openChannel();
            channel.prefetch(concurrency);
            consumerTag = channel.consume(queueName, this);
        } catch (BrokerException e) {
            running.set(false);
            executor.shutdownNow();
            closeChannel();
            throw e;
        }

        log.info("Started worker for queue={}, microservice={}, concurrency={}",
            queueName, microservice, concurrency);
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        if (!running.get()) {
            // Never started, already stopped, or the broker cancelled the consumer
            if (executor != null) {
                executor.shutdown();
            }
            closeChannel();
            return CompletableFuture.completedFuture(null);
        }

        stopping.set(true);
        cancelConsumer();
        log.info("Stopping worker for {}, waiting for {} in-flight deliveries",
            queueName, inFlightCount.get());

        return CompletableFuture.runAsync(() -> {
            try {
                long deadline = System.currentTimeMillis() + timeout.toMillis();
                while (inFlightCount.get() > 0 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(50);
                }

                if (inFlightCount.get() > 0) {
                    log.warn("Timeout waiting for {} in-flight deliveries on {}", inFlightCount.get(), queueName);
                }

                running.set(false);
                executor.shutdown();

                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }

                closeChannel();
                log.info("Worker for {} stopped", queueName);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
    }

    @Override
    public void stopNow() {
        stopping.set(true);
        running.set(false);
        if (executor != null) {
            executor.shutdownNow();
        }
        closeChannel();
    }

    @Override
    public boolean isRunning() {
        return running.get() && !stopping.get();
    }

    @Override
    public int inFlightCount() {
        return inFlightCount.get();
    }

    @Override
    public String queueName() {
        return queueName;
    }

    @Override
    public Microservice microservice() {
        return microservice;
    }

    @Override
    public int getConsecutiveErrorCount() {
        return consecutiveErrors.get();
    }

    // --- Broker callbacks ---

    @Override
    public void onDelivery(Delivery delivery) {
        Settlement settlement = new Settlement(channel, delivery.deliveryTag());

        if (stopping.get()) {
            log.debug("Worker for {} stopping, returning delivery {}", queueName, delivery.deliveryTag());
            settle(() -> settlement.nack(true), delivery);
            return;
        }

        inFlightCount.incrementAndGet();
        try {
            executor.execute(() -> {
                try {
                    process(delivery, settlement);
                } catch (RuntimeException e) {
                    log.error("Unexpected error processing delivery {} on {}", delivery.deliveryTag(), queueName, e);
                    if (!settlement.isSettled()) {
                        settle(() -> settlement.nack(false), delivery);
                    }
                } finally {
                    inFlightCount.decrementAndGet();
                }
            });
        } catch (RejectedExecutionException e) {
            inFlightCount.decrementAndGet();
            settle(() -> settlement.nack(true), delivery);
        }
    }

    @Override
    public void onTerminated(String tag, String reason) {
        if (stopping.get()) {
            return;
        }
        log.error("Consumer {} on {} terminated: {}", tag, queueName, reason);
        consecutiveErrors.incrementAndGet();
        running.set(false);
        // Queued tasks still run; their settlements fail once the channel is gone
        ExecutorService current = executor;
        if (current != null) {
            current.shutdown();
        }
    }

    // --- Helpers for subclasses ---

    /**
     * Settle a delivery, containing transport failures. A failed settlement leaves the
     * delivery to the broker, which redelivers it once the channel is gone.
     *
     * @return true if the broker call succeeded
     */
    protected boolean settle(Runnable settlement, Delivery delivery) {
        try {
            settlement.run();
            consecutiveErrors.set(0);
            return true;
        } catch (BrokerException e) {
            consecutiveErrors.incrementAndGet();
            log.error("Failed to settle delivery {} on {}: {}", delivery.deliveryTag(), queueName, e.getMessage());
            return false;
        }
    }

    private void cancelConsumer() {
        BrokerChannel current = channel;
        String tag = consumerTag;
        if (current == null || tag == null || !current.isOpen()) {
            return;
        }
        try {
            current.cancel(tag);
        } catch (BrokerException e) {
            log.warn("Failed to cancel consumer {} on {}: {}", tag, queueName, e.getMessage());
        }
    }

    private void closeChannel() {
        BrokerChannel current = channel;
        if (current != null) {
            current.close();
        }
    }

    private ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "eventbus-" + queueName + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
