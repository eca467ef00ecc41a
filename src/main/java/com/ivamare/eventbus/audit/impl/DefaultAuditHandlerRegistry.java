package com.ivamare.eventbus.audit.impl;

import com.ivamare.eventbus.audit.AuditHandler;
import com.ivamare.eventbus.audit.AuditHandlerRegistry;
import com.ivamare.eventbus.audit.OnAudit;
import com.ivamare.eventbus.exception.HandlerAlreadyRegisteredException;
import com.ivamare.eventbus.exception.HandlerNotFoundException;
import com.ivamare.eventbus.model.AuditContext;
import com.ivamare.eventbus.model.AuditPayload;
import com.ivamare.eventbus.model.EventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanPostProcessor;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of AuditHandlerRegistry, discovering @OnAudit methods on Spring beans.
 */
public class DefaultAuditHandlerRegistry implements AuditHandlerRegistry, BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultAuditHandlerRegistry.class);

    private final Map<EventKind, AuditHandler<AuditPayload>> handlers = new ConcurrentHashMap<>();

    @Override
    public <A extends AuditPayload> void register(EventKind kind, Class<A> recordType, AuditHandler<A> handler) {
        if (!kind.isAudit()) {
            throw new IllegalArgumentException("Event " + kind + " is not an audit event");
        }
        if (!kind.getPayloadType().equals(recordType)) {
            throw new IllegalArgumentException("Audit event " + kind + " carries "
                + kind.getPayloadType().getSimpleName() + ", not " + recordType.getSimpleName());
        }

        AuditHandler<AuditPayload> typed = (record, context) -> handler.handle(recordType.cast(record), context);
        if (handlers.putIfAbsent(kind, typed) != null) {
            throw new HandlerAlreadyRegisteredException(kind);
        }
        log.debug("Registered audit handler for {}", kind);
    }

    @Override
    public void dispatch(AuditPayload record, AuditContext context) throws Exception {
        AuditHandler<AuditPayload> handler = handlers.get(record.eventKind());
        if (handler == null) {
            throw new HandlerNotFoundException(record.eventKind());
        }
        handler.handle(record, context);
    }

    @Override
    public boolean hasHandler(EventKind kind) {
        return handlers.containsKey(kind);
    }

    @Override
    public Set<EventKind> registeredEvents() {
        return handlers.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(handlers.keySet()));
    }

    @Override
    public void clear() {
        handlers.clear();
    }

    @Override
    public List<EventKind> registerBean(Object bean) {
        List<EventKind> registered = new ArrayList<>();
        for (Method method : bean.getClass().getMethods()) {
            OnAudit annotation = method.getAnnotation(OnAudit.class);
            if (annotation == null) {
                continue;
            }
            EventKind kind = annotation.value();
            Class<?>[] params = method.getParameterTypes();
            if (params.length != 2 || !params[0].equals(kind.getPayloadType())
                    || !params[1].equals(AuditContext.class)) {
                throw new IllegalArgumentException("Audit handler method " + method.getName()
                    + " must have signature: void methodName("
                    + kind.getPayloadType().getSimpleName() + " record, AuditContext context)");
            }
            registerMethod(bean, method, kind);
            registered.add(kind);
            log.info("Discovered audit handler {}.{}() for {}",
                bean.getClass().getSimpleName(), method.getName(), kind);
        }
        return registered;
    }

    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        if (Arrays.stream(bean.getClass().getMethods()).anyMatch(m -> m.isAnnotationPresent(OnAudit.class))) {
            registerBean(bean);
        }
        return bean;
    }

    @SuppressWarnings("unchecked")
    private void registerMethod(Object bean, Method method, EventKind kind) {
        if (!kind.isAudit()) {
            throw new IllegalArgumentException("Event " + kind + " is not an audit event");
        }
        Class<AuditPayload> recordType = (Class<AuditPayload>) kind.getPayloadType();
        register(kind, recordType, (record, context) -> {
            try {
                method.invoke(bean, record, context);
            } catch (InvocationTargetException e) {
                if (e.getCause() instanceof Exception cause) {
                    throw cause;
                }
                throw e;
            }
        });
    }
}
