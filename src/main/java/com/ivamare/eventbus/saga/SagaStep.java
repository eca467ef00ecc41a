package com.ivamare.eventbus.saga;

import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventContext;

/**
 * One step of a saga, triggered by an event of payload type {@code P}.
 *
 * @param <P> payload of the triggering event
 */
public interface SagaStep<P extends BusinessEvent> {

    /**
     * @return step name used in logs and failures
     */
    String name();

    /**
     * Perform the step.
     *
     * @param payload The triggering event
     * @param context Delivery context
     * @return the event that triggers the next step, or null when the saga is complete
     * @throws StepFailedException to compensate instead of continuing
     * @throws Exception any other failure, retried by the retry policy
     */
    BusinessEvent execute(P payload, EventContext context) throws Exception;

    /**
     * Build the event that starts compensation after a business failure of this step.
     *
     * @param payload The triggering event
     * @param context Delivery context
     * @param failure The failure raised by {@link #execute}
     * @return the compensation event, or null when there is nothing to undo
     */
    default BusinessEvent compensate(P payload, EventContext context, StepFailedException failure) {
        return null;
    }
}
