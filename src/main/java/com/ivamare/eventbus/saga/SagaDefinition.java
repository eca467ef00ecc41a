package com.ivamare.eventbus.saga;

import com.ivamare.eventbus.api.EventPublisher;
import com.ivamare.eventbus.handler.EventHandler;
import com.ivamare.eventbus.handler.HandlerRegistry;
import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A saga expressed as the steps and compensations one microservice takes part in.
 *
 * <p>There is no central coordinator: each step is registered as the handler of its trigger
 * event and publishes the event of the next step.
 *
 * <pre>
 * SagaDefinition.named("checkout")
 *     .step(EventKind.ORDER_CREATED, OrderCreatedPayload.class, requestPayment)
 *     .compensation(EventKind.PAYMENT_FAILED, PaymentFailedPayload.class, cancelOrder)
 *     .register(handlerRegistry, publisher);
 * </pre>
 */
public final class SagaDefinition {

    private final String name;
    private final List<Registration<?>> registrations = new ArrayList<>();

    private SagaDefinition(String name) {
        this.name = name;
    }

    public static SagaDefinition named(String name) {
        return new SagaDefinition(name);
    }

    public String name() {
        return name;
    }

    /**
     * Add a step triggered by an event.
     */
    public <P extends BusinessEvent> SagaDefinition step(EventKind trigger, Class<P> payloadType, SagaStep<P> step) {
        registrations.add(new Registration<>(trigger, payloadType, step, null));
        return this;
    }

    /**
     * Add a compensation handler, which undoes an earlier step when its event arrives.
     */
    public <P extends BusinessEvent> SagaDefinition compensation(EventKind trigger, Class<P> payloadType,
                                                                 EventHandler<P> handler) {
        registrations.add(new Registration<>(trigger, payloadType, null, handler));
        return this;
    }

    /**
     * @return the event kinds this saga consumes, for the consumer's subscriptions
     */
    public Set<EventKind> triggers() {
        if (registrations.isEmpty()) {
            return Set.of();
        }
        EnumSet<EventKind> kinds = EnumSet.noneOf(EventKind.class);
        registrations.forEach(r -> kinds.add(r.trigger()));
        return Collections.unmodifiableSet(kinds);
    }

    /**
     * Register every step and compensation as a business handler.
     *
     * @param handlerRegistry registry of the consuming worker
     * @param publisher publisher used to emit the next or compensation events
     */
    public void register(HandlerRegistry handlerRegistry, EventPublisher publisher) {
        for (Registration<?> registration : registrations) {
            registration.register(name, handlerRegistry, publisher);
        }
    }

    private record Registration<P extends BusinessEvent>(
        EventKind trigger,
        Class<P> payloadType,
        SagaStep<P> step,
        EventHandler<P> handler
    ) {
        void register(String sagaName, HandlerRegistry registry, EventPublisher publisher) {
            EventHandler<P> effective = step != null
                ? new SagaStepHandler<>(sagaName, step, publisher)
                : handler;
            registry.register(trigger, payloadType, effective);
        }
    }
}
