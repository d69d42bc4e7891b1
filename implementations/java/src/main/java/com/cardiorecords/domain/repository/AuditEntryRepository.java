package com.cardiorecords.domain.repository;

import com.cardiorecords.domain.model.AuditEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/**
 * Append-only store for audit entries. There is intentionally no update or
 * delete operation.
 */
public interface AuditEntryRepository {

    AuditEntry append(AuditEntry entry);

    /**
     * Newest first.
     */
    Page<AuditEntry> search(AuditSearchCriteria criteria, Pageable pageable);
}
