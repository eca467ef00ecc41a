package com.ivamare.eventbus.saga;

import com.ivamare.eventbus.api.EventPublisher;
import com.ivamare.eventbus.handler.EventHandler;
import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link SagaStep} as an ordinary business event handler.
 *
 * <p>On success the next step's event is published; on {@link StepFailedException} the
 * compensation event is published instead. Either way the delivery then completes, so the
 * saga advances purely through published events. Other failures propagate and are retried,
 * which can execute the step again: steps must be idempotent.
 *
 * @param <P> payload of the triggering event
 */
public class SagaStepHandler<P extends BusinessEvent> implements EventHandler<P> {

    private static final Logger log = LoggerFactory.getLogger(SagaStepHandler.class);

    private final String sagaName;
    private final SagaStep<P> step;
    private final EventPublisher publisher;

    public SagaStepHandler(String sagaName, SagaStep<P> step, EventPublisher publisher) {
        this.sagaName = sagaName;
        this.step = step;
        this.publisher = publisher;
    }

    @Override
    public void handle(P payload, EventContext context) throws Exception {
        BusinessEvent next;
        try {
            next = step.execute(payload, context);
        } catch (StepFailedException e) {
            compensate(payload, context, e);
            return;
        }

        if (next == null) {
            log.info("Saga {} completed at step {} (eventId={})", sagaName, step.name(), context.eventId());
            return;
        }

        publisher.publish(next);
        log.debug("Saga {} step {} done, next {}", sagaName, step.name(), next.eventKind());
    }

    private void compensate(P payload, EventContext context, StepFailedException failure) {
        log.warn("Saga {} step {} failed [{}]: {}",
            sagaName, step.name(), failure.getErrorCode(), failure.getMessage());

        BusinessEvent compensation = step.compensate(payload, context, failure);
        if (compensation == null) {
            log.info("Saga {} step {} has nothing to compensate", sagaName, step.name());
            return;
        }

        publisher.publish(compensation);
        log.info("Saga {} compensating with {}", sagaName, compensation.eventKind());
    }
}
