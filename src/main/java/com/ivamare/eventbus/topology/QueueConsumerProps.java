package com.ivamare.eventbus.topology;

import com.ivamare.eventbus.model.EventKind;
import com.ivamare.eventbus.model.Microservice;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * The event kinds a microservice subscribes to, and the queue names derived from it.
 *
 * @param microservice The consuming microservice
 * @param events Subscribed business event kinds
 */
public record QueueConsumerProps(Microservice microservice, Set<EventKind> events) {

    public QueueConsumerProps {
        if (microservice == null) {
            throw new IllegalArgumentException("microservice is required");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("At least one event kind is required for " + microservice);
        }
        for (EventKind kind : events) {
            if (kind.isAudit()) {
                throw new IllegalArgumentException(
                    "Audit event " + kind + " cannot be subscribed by a business queue");
            }
        }
        events = Set.copyOf(EnumSet.copyOf(events));
    }

    public static QueueConsumerProps of(Microservice microservice, EventKind... events) {
        return new QueueConsumerProps(microservice, Set.copyOf(Arrays.asList(events)));
    }

    public static QueueConsumerProps of(Microservice microservice, Collection<EventKind> events) {
        return new QueueConsumerProps(microservice, Set.copyOf(events));
    }

    public String queueName() {
        return QueueNames.eventQueue(microservice);
    }

    public String requeueQueueName() {
        return QueueNames.requeueQueue(microservice);
    }

    public String deadLetterQueueName() {
        return QueueNames.deadLetterQueue(microservice);
    }

    public String auditQueueName() {
        return QueueNames.auditQueue(microservice);
    }

    public boolean subscribes(EventKind kind) {
        return events.contains(kind);
    }
}
