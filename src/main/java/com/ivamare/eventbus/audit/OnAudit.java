package com.ivamare.eventbus.audit;

import com.ivamare.eventbus.model.EventKind;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as an audit record handler.
 *
 * <p>Signature: {@code void handleXxx(AuditProcessed record, AuditContext context)}, where the
 * first parameter is the record type of the annotated audit kind.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface OnAudit {

    /**
     * @return one of the audit event kinds
     */
    EventKind value();
}
