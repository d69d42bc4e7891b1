package com.cardiorecords.infrastructure.persistence;

import com.cardiorecords.domain.model.AuditEntry;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.repository.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data repository for {@link AuditEntry}. Extends the bare
 * {@link Repository} so no delete or bulk update methods are generated.
 */
@org.springframework.stereotype.Repository
public interface SpringDataAuditEntryRepository
        extends Repository<AuditEntry, UUID>, JpaSpecificationExecutor<AuditEntry> {

    AuditEntry save(AuditEntry entry);

    Optional<AuditEntry> findById(UUID id);

    long count();
}
