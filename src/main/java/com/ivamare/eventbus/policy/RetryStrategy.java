package com.ivamare.eventbus.policy;

/**
 * How the delay between retries grows.
 */
public enum RetryStrategy {

    /** Same delay before every retry. */
    FIXED_DELAY,

    /** Delay of the n-th retry is the n-th fibonacci number times the base delay. */
    FIBONACCI
}
