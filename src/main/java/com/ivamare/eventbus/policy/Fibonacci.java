package com.ivamare.eventbus.policy;

/**
 * Fibonacci numbers for retry backoff.
 */
public final class Fibonacci {

    /** Largest n whose fibonacci number fits in a long. */
    public static final int MAX_N = 92;

    private Fibonacci() {
        // Utility class
    }

    /**
     * The n-th fibonacci number with {@code fib(1) = fib(2) = 1}.
     *
     * @param n position, 1-based
     * @return fib(n); 0 for n &lt;= 0
     */
    public static long of(int n) {
        if (n <= 0) {
            return 0;
        }
        int bounded = Math.min(n, MAX_N);
        long previous = 0;
        long current = 1;
        for (int i = 1; i < bounded; i++) {
            long next = previous + current;
            previous = current;
            current = next;
        }
        return current;
    }
}
