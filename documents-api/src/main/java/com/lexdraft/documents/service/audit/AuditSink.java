package com.lexdraft.documents.service.audit;

/**
 * Fire-and-forget destination for audit facts. Implementations must not throw: a lost audit event is
 * logged, never allowed to fail the operation that produced it.
 */
public interface AuditSink {

    void emit(AuditEvent event);
}
