package com.ivamare.eventbus.handler;

import com.ivamare.eventbus.model.EventKind;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a business event handler.
 *
 * <p>Methods annotated with @OnEvent are discovered and registered by the
 * {@link HandlerRegistry} when the bean is created by Spring.
 *
 * <p>Handler methods must have the signature:
 * <pre>
 * void handleXxx(PayloadType payload, EventContext context)
 * </pre>
 * where {@code PayloadType} is the payload record of the annotated event kind.
 *
 * <p>Example:
 * <pre>
 * {@literal @}Component
 * public class PaymentHandlers {
 *
 *     {@literal @}OnEvent(EventKind.PAYMENT_REQUESTED)
 *     public void onPaymentRequested(PaymentRequestedPayload payload, EventContext context) {
 *         // Charge the customer...
 *     }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface OnEvent {

    /**
     * @return the business event kind handled by the method
     */
    EventKind value();
}
