package com.ivamare.eventbus.model;

/**
 * Terminal outcome of a delivery. Every delivery reaches exactly one.
 */
public enum Disposition {

    /** Handler succeeded and the delivery was acked. */
    ACKED,

    /** Handler failed, a delayed copy was scheduled and the original settled. */
    REQUEUED,

    /** Delivery was nacked without requeue and routed to the dead-letter queue. */
    DEAD_LETTERED
}
