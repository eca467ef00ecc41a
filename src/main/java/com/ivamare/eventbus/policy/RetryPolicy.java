package com.ivamare.eventbus.policy;

import com.ivamare.eventbus.model.Delivery;

import java.time.Duration;

/**
 * Policy for redelivering failed events.
 *
 * <p>The policy is stateless: the number of retries already performed travels on the message
 * itself, so {@link #decide(Delivery)} only needs the delivery.
 *
 * @param strategy How delays grow between retries
 * @param maxAttempts Maximum number of retries before dead-lettering
 * @param delay Fixed delay, or the time unit multiplied by the fibonacci number
 * @param maxOccurrence Fibonacci position after which the sequence restarts at 1; 0 never restarts
 */
public record RetryPolicy(
    RetryStrategy strategy,
    int maxAttempts,
    Duration delay,
    int maxOccurrence
) {

    /**
     * Longest delay a retry waits: the largest per-message expiration RabbitMQ accepts.
     */
    public static final Duration MAX_BACKOFF = Duration.ofMillis(0xFFFF_FFFFL);

    public RetryPolicy {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be zero or positive");
        }
        if (maxOccurrence < 0) {
            throw new IllegalArgumentException("maxOccurrence must not be negative");
        }
    }

    /**
     * Default retry policy: fibonacci backoff in seconds, 3 retries.
     *
     * @return Default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return fibonacci(Duration.ofSeconds(1), 3);
    }

    /**
     * Create a policy with no retries: the first failure dead-letters.
     *
     * @return No retry policy
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(RetryStrategy.FIXED_DELAY, 0, Duration.ZERO, 0);
    }

    public static RetryPolicy fixedDelay(Duration delay, int maxAttempts) {
        return new RetryPolicy(RetryStrategy.FIXED_DELAY, maxAttempts, delay, 0);
    }

    public static RetryPolicy fibonacci(Duration unit, int maxAttempts) {
        return new RetryPolicy(RetryStrategy.FIBONACCI, maxAttempts, unit, 0);
    }

    public static RetryPolicy fibonacci(Duration unit, int maxAttempts, int maxOccurrence) {
        return new RetryPolicy(RetryStrategy.FIBONACCI, maxAttempts, unit, maxOccurrence);
    }

    /**
     * Get the delay before the given retry.
     *
     * @param attempt The retry number (1-based)
     * @return delay before that retry, at most {@link #MAX_BACKOFF}
     */
    public Duration getBackoff(int attempt) {
        if (strategy == RetryStrategy.FIXED_DELAY) {
            return cap(delay);
        }
        if (delay.isZero()) {
            return Duration.ZERO;
        }
        long factor = Fibonacci.of(attempt);
        if (factor > MAX_BACKOFF.dividedBy(delay)) {
            return MAX_BACKOFF;
        }
        return cap(delay.multipliedBy(factor));
    }

    /**
     * Check if another retry should be attempted.
     *
     * @param retriesPerformed Retries already performed
     * @return true if more retries are allowed
     */
    public boolean shouldRetry(int retriesPerformed) {
        return retriesPerformed < maxAttempts;
    }

    /**
     * Decide what happens to a delivery whose handler failed.
     *
     * @param delivery the failed delivery
     * @return retry with incremented attempt and its delay, or dead-letter
     */
    public RetryDecision decide(Delivery delivery) {
        int retriesPerformed = delivery.retryCount();
        if (!shouldRetry(retriesPerformed)) {
            return RetryDecision.deadLetter(retriesPerformed);
        }

        int attempt = retriesPerformed + 1;
        if (strategy == RetryStrategy.FIXED_DELAY) {
            return RetryDecision.retry(attempt, delay, 0);
        }

        int occurrence = nextOccurrence(delivery.occurrence());
        return RetryDecision.retry(attempt, getBackoff(occurrence), occurrence);
    }

    private int nextOccurrence(int previous) {
        if (maxOccurrence > 0 && previous >= maxOccurrence) {
            return 1;
        }
        // The header comes off the wire, so keep it within the computable sequence
        return Math.min(Math.max(previous, 0), Fibonacci.MAX_N - 1) + 1;
    }

    private static Duration cap(Duration backoff) {
        return backoff.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : backoff;
    }
}
