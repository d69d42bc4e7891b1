package com.cardiorecords.infrastructure.audit;

import com.cardiorecords.application.exceptions.AuditException;
import com.cardiorecords.domain.model.AuditEntry;

/**
 * Durable sink for audit entries.
 */
public interface AuditTrail {

    /**
     * Persists the entry in its own transaction.
     *
     * @throws AuditException if the entry could not be written
     */
    void record(AuditEntry entry);
}
