package com.ivamare.eventbus.handler.impl;

import com.ivamare.eventbus.exception.HandlerAlreadyRegisteredException;
import com.ivamare.eventbus.exception.HandlerNotFoundException;
import com.ivamare.eventbus.handler.EventHandler;
import com.ivamare.eventbus.handler.HandlerRegistry;
import com.ivamare.eventbus.handler.OnEvent;
import com.ivamare.eventbus.model.BusinessEvent;
import com.ivamare.eventbus.model.EventContext;
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
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of HandlerRegistry.
 *
 * <p>Implements BeanPostProcessor to automatically discover and register
 * handlers from Spring beans annotated with @OnEvent.
 */
public class DefaultHandlerRegistry implements HandlerRegistry, BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultHandlerRegistry.class);

    private final Map<EventKind, EventHandler<BusinessEvent>> handlers = new ConcurrentHashMap<>();

    @Override
    public <P extends BusinessEvent> void register(EventKind kind, Class<P> payloadType, EventHandler<P> handler) {
        if (kind.isAudit()) {
            throw new IllegalArgumentException(
                "Audit event " + kind + " must be registered with the audit handler registry");
        }
        if (!kind.getPayloadType().equals(payloadType)) {
            throw new IllegalArgumentException("Event " + kind + " carries "
                + kind.getPayloadType().getSimpleName() + ", not " + payloadType.getSimpleName());
        }

        EventHandler<BusinessEvent> typed = (payload, context) -> handler.handle(payloadType.cast(payload), context);
        if (handlers.putIfAbsent(kind, typed) != null) {
            throw new HandlerAlreadyRegisteredException(kind);
        }
        log.debug("Registered handler for {}", kind);
    }

    @Override
    public Optional<EventHandler<BusinessEvent>> get(EventKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }

    @Override
    public void dispatch(BusinessEvent payload, EventContext context) throws Exception {
        EventKind kind = payload.eventKind();
        EventHandler<BusinessEvent> handler = get(kind)
            .orElseThrow(() -> new HandlerNotFoundException(kind));
        log.debug("Dispatching {} (eventId={})", kind, context.eventId());
        handler.handle(payload, context);
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
            OnEvent annotation = method.getAnnotation(OnEvent.class);
            if (annotation == null) {
                continue;
            }

            EventKind kind = annotation.value();
            validateHandlerMethod(method, kind);

            registerMethod(bean, method, kind);
            registered.add(kind);

            log.info("Discovered handler {}.{}() for {}",
                bean.getClass().getSimpleName(), method.getName(), kind);
        }

        return registered;
    }

    /**
     * BeanPostProcessor callback - scans beans for @OnEvent methods.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        boolean hasHandlers = Arrays.stream(bean.getClass().getMethods())
            .anyMatch(m -> m.isAnnotationPresent(OnEvent.class));

        if (hasHandlers) {
            registerBean(bean);
        }

        return bean;
    }

    @SuppressWarnings("unchecked")
    private void registerMethod(Object bean, Method method, EventKind kind) {
        Class<BusinessEvent> payloadType = (Class<BusinessEvent>) kind.getPayloadType();
        register(kind, payloadType, (payload, context) -> {
            try {
                method.invoke(bean, payload, context);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception exception) {
                    throw exception;
                }
                throw e;
            }
        });
    }

    private void validateHandlerMethod(Method method, EventKind kind) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length != 2 ||
            !params[0].equals(kind.getPayloadType()) ||
            !params[1].equals(EventContext.class)) {

            throw new IllegalArgumentException(
                "Handler method " + method.getName() + " must have signature: " +
                "void methodName(" + kind.getPayloadType().getSimpleName() + " payload, EventContext context)"
            );
        }
    }
}
