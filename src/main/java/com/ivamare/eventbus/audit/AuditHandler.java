package com.ivamare.eventbus.audit;

import com.ivamare.eventbus.model.AuditContext;
import com.ivamare.eventbus.model.AuditPayload;

/**
 * Handler for audit records.
 *
 * <p>Audit handlers run in the audit worker, which is never wrapped with audit emission and
 * has no publisher: consuming an audit record can never produce another one.
 *
 * @param <A> audit record type
 */
@FunctionalInterface
public interface AuditHandler<A extends AuditPayload> {

    void handle(A record, AuditContext context) throws Exception;
}
