package com.ivamare.eventbus.handler;

import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventContext;
import com.ivamare.eventbus.model.EventKind;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registry for business event handlers.
 *
 * <p>Maps event kinds to handlers. Only business kinds can be registered; audit records are
 * handled through {@link com.ivamare.eventbus.audit.AuditHandlerRegistry}.
 */
public interface HandlerRegistry {

    /**
     * Register a handler for an event kind.
     *
     * @param kind The business event kind
     * @param payloadType Payload record of that kind
     * @param handler The handler
     * @param <P> payload type
     * @throws com.ivamare.eventbus.exception.HandlerAlreadyRegisteredException if handler exists
     * @throws IllegalArgumentException if the kind is an audit kind or the payload type does not match
     */
    <P extends BusinessEvent> void register(EventKind kind, Class<P> payloadType, EventHandler<P> handler);

    Optional<EventHandler<BusinessEvent>> get(EventKind kind);

    /**
     * Dispatch a payload to its registered handler.
     *
     * @param payload The decoded payload
     * @param context Delivery context
     * @throws com.ivamare.eventbus.exception.HandlerNotFoundException if no handler registered
     * @throws Exception from handler execution
     */
    void dispatch(BusinessEvent payload, EventContext context) throws Exception;

    boolean hasHandler(EventKind kind);

    /**
     * @return kinds with a registered handler
     */
    Set<EventKind> registeredEvents();

    /**
     * Remove all handlers. Useful for testing.
     */
    void clear();

    /**
     * Scan a bean for @OnEvent annotated methods and register them.
     *
     * @param bean The bean to scan
     * @return kinds registered from the bean
     */
    List<EventKind> registerBean(Object bean);
}
