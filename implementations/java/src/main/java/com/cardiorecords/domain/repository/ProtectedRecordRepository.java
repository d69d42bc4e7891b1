package com.cardiorecords.domain.repository;

import com.cardiorecords.domain.model.ProtectedRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Store for clinical artifact records.
 *
 * <p>Every lookup is scoped to an owner; a record that exists but belongs to
 * somebody else is indistinguishable from a missing one.
 */
public interface ProtectedRecordRepository {

    ProtectedRecord save(ProtectedRecord record);

    Optional<ProtectedRecord> findOwned(UUID id, UUID ownerId);

    /**
     * Newest first. The payload column is loaded with the entity but callers
     * listing records must not expose it.
     */
    Page<ProtectedRecord> search(UUID ownerId, RecordSearchCriteria criteria, Pageable pageable);

    List<ClassificationStatistics> statistics(UUID ownerId);

    long countOwned(UUID ownerId);

    Optional<ProtectedRecord> findLatest(UUID ownerId);

    boolean deleteOwned(UUID id, UUID ownerId);

    long deleteAllOwned(UUID ownerId);
}
