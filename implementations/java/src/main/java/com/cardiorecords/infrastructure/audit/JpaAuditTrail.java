package com.cardiorecords.infrastructure.audit;

import com.cardiorecords.application.exceptions.AuditException;
import com.cardiorecords.domain.model.AuditEntry;
import com.cardiorecords.domain.repository.AuditEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link AuditTrail} backed by the audit entry table.
 *
 * Runs in a new transaction so an audit write neither joins nor rolls back the
 * caller's work.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JpaAuditTrail implements AuditTrail {

    private final AuditEntryRepository auditEntries;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(AuditEntry entry) {
        log.info("AUDIT action={} resource={}/{} actor={} status={}",
            entry.getAction(), entry.getResourceKind(), entry.getResourceId(), entry.getActorId(),
            entry.getOutcome() == null ? null : entry.getOutcome().getStatusCode());
        try {
            auditEntries.append(entry);
        } catch (RuntimeException e) {
            throw new AuditException("Failed to append audit entry " + entry.getId(), e);
        }
    }
}
