package com.jobd.audit;

/**
 * Durable destination for client-side audit records.
 */
public interface AuditSink extends AutoCloseable {

    void record(AuditRecord record);

    @Override
    default void close() {
    }
}
