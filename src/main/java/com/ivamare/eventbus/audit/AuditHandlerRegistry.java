package com.ivamare.eventbus.audit;

import com.ivamare.eventbus.model.AuditContext;
import com.ivamare.eventbus.model.AuditPayload;
import com.ivamare.eventbus.model.EventKind;

import java.util.List;
import java.util.Set;

/**
 * Registry for audit record handlers. Accepts audit kinds only.
 */
public interface AuditHandlerRegistry {

    /**
     * @throws com.ivamare.eventbus.exception.HandlerAlreadyRegisteredException if handler exists
     * @throws IllegalArgumentException if the kind is not an audit kind or the type does not match
     */
    <A extends AuditPayload> void register(EventKind kind, Class<A> recordType, AuditHandler<A> handler);

    /**
     * @throws com.ivamare.eventbus.exception.HandlerNotFoundException if no handler registered
     */
    void dispatch(AuditPayload record, AuditContext context) throws Exception;

    boolean hasHandler(EventKind kind);

    Set<EventKind> registeredEvents();

    void clear();

    List<EventKind> registerBean(Object bean);
}
