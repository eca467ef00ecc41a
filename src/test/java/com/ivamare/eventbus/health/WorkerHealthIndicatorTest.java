package com.ivamare.eventbus.health;

import com.ivamare.eventbus.worker.Worker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WorkerHealthIndicator")
class WorkerHealthIndicatorTest {

    private static Worker worker(String queue, boolean running, int inFlight, int errors) {
        Worker worker = mock(Worker.class);
        when(worker.queueName()).thenReturn(queue);
        when(worker.isRunning()).thenReturn(running);
        when(worker.inFlightCount()).thenReturn(inFlight);
        when(worker.getConsecutiveErrorCount()).thenReturn(errors);
        return worker;
    }

    @Test
    @DisplayName("should report UNKNOWN without workers")
    void shouldReportUnknownWithoutWorkers() {
        Health health = new WorkerHealthIndicator(List.of()).health();

        assertEquals(Status.UNKNOWN, health.getStatus());
    }

    @Test
    @DisplayName("should report UP with details per queue")
    void shouldReportUp() {
        WorkerHealthIndicator indicator = new WorkerHealthIndicator(List.of(
            worker("payments__events", true, 2, 0),
            worker("orders__events", true, 1, 1)));

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(3, health.getDetails().get("totalInFlight"));
        assertEquals(1, health.getDetails().get("maxConsecutiveErrors"));
        @SuppressWarnings("unchecked")
        Map<String, WorkerHealthIndicator.WorkerStatus> statuses =
            (Map<String, WorkerHealthIndicator.WorkerStatus>) health.getDetails().get("workers");
        assertEquals(List.of("orders__events", "payments__events"), List.copyOf(statuses.keySet()));
        assertEquals(new WorkerHealthIndicator.WorkerStatus(true, 2, 0), statuses.get("payments__events"));
    }

    @Test
    @DisplayName("should report DOWN when a worker stopped")
    void shouldReportDownWhenStopped() {
        WorkerHealthIndicator indicator = new WorkerHealthIndicator(List.of(
            worker("payments__events", true, 0, 0),
            worker("audit-eda__audit", false, 0, 0)));

        assertEquals(Status.DOWN, indicator.health().getStatus());
    }

    @Test
    @DisplayName("should report DOWN after repeated broker errors")
    void shouldReportDownOnErrors() {
        WorkerHealthIndicator indicator = new WorkerHealthIndicator(List.of(
            worker("payments__events", true, 0, WorkerHealthIndicator.MAX_CONSECUTIVE_ERRORS)));

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(WorkerHealthIndicator.MAX_CONSECUTIVE_ERRORS, health.getDetails().get("maxConsecutiveErrors"));
    }
}
