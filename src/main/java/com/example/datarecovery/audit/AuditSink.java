package com.example.datarecovery.audit;

/**
 * Destination of audit events. Callers treat delivery as fire-and-forget;
 * implementations signal failure by throwing.
 */
public interface AuditSink {

    void logAudit(AuditEvent event);
}
