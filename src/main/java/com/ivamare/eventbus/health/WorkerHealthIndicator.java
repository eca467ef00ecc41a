package com.ivamare.eventbus.health;

import com.ivamare.eventbus.worker.Worker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for Event Bus workers.
 *
 * <p>Reports each worker by queue name with its running state, in-flight deliveries
 * and consecutive settlement errors. DOWN when a worker stopped unexpectedly or keeps
 * failing to reach the broker.
 */
public class WorkerHealthIndicator implements HealthIndicator {

    static final int MAX_CONSECUTIVE_ERRORS = 5;

    private final List<Worker> workers;

    public WorkerHealthIndicator(List<Worker> workers) {
        this.workers = workers != null ? workers : List.of();
    }

    @Override
    public Health health() {
        if (workers.isEmpty()) {
            return Health.unknown()
                .withDetail("message", "No workers registered")
                .build();
        }

        Map<String, WorkerStatus> statuses = new TreeMap<>();
        int totalInFlight = 0;
        int maxConsecutiveErrors = 0;
        boolean allRunning = true;

        for (Worker worker : workers) {
            int errors = worker.getConsecutiveErrorCount();
            statuses.putIfAbsent(worker.queueName(),
                new WorkerStatus(worker.isRunning(), worker.inFlightCount(), errors));
            totalInFlight += worker.inFlightCount();
            maxConsecutiveErrors = Math.max(maxConsecutiveErrors, errors);
            allRunning &= worker.isRunning();
        }

        boolean healthy = allRunning && maxConsecutiveErrors < MAX_CONSECUTIVE_ERRORS;
        Health.Builder builder = healthy ? Health.up() : Health.down();

        return builder
            .withDetail("workers", statuses)
            .withDetail("totalInFlight", totalInFlight)
            .withDetail("maxConsecutiveErrors", maxConsecutiveErrors)
            .build();
    }

    record WorkerStatus(boolean running, int inFlight, int consecutiveErrors) {}
}
