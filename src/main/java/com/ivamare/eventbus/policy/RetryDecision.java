package com.ivamare.eventbus.policy;

import java.time.Duration;

/**
 * Outcome of consulting a {@link RetryPolicy} for a failed delivery.
 *
 * @param retry Whether the delivery is retried (false means dead-letter)
 * @param attempt Retry count written on the requeued message, or retries performed when dead-lettering
 * @param delay Time the requeued message waits before reappearing; zero when dead-lettering
 * @param occurrence Fibonacci occurrence written on the requeued message; zero for fixed delay
 */
public record RetryDecision(boolean retry, int attempt, Duration delay, int occurrence) {

    public static RetryDecision retry(int attempt, Duration delay, int occurrence) {
        return new RetryDecision(true, attempt, delay, occurrence);
    }

    public static RetryDecision deadLetter(int attempts) {
        return new RetryDecision(false, attempts, Duration.ZERO, 0);
    }
}
