package com.ivamare.eventbus.model;

import java.time.Instant;

/**
 * Context provided to audit handlers.
 *
 * <p>Carries no publishing capability: audit consumers only read.
 *
 * @param auditKind Kind of the audit record
 * @param microservice Owner of the audit queue
 * @param queueName Audit queue the record was consumed from
 * @param receivedAt When the record was received
 */
public record AuditContext(
    EventKind auditKind,
    Microservice microservice,
    String queueName,
    Instant receivedAt
) {
}
