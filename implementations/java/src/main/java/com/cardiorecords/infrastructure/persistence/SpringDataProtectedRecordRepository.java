package com.cardiorecords.infrastructure.persistence;

import com.cardiorecords.domain.model.ProtectedRecord;
import com.cardiorecords.domain.repository.ClassificationStatistics;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for {@link ProtectedRecord}.
 */
@Repository
public interface SpringDataProtectedRecordRepository
        extends JpaRepository<ProtectedRecord, UUID>, JpaSpecificationExecutor<ProtectedRecord> {

    Optional<ProtectedRecord> findByIdAndOwnerId(UUID id, UUID ownerId);

    Optional<ProtectedRecord> findFirstByOwnerIdOrderByCreatedAtDesc(UUID ownerId);

    long countByOwnerId(UUID ownerId);

    @Query("""
        SELECT new com.cardiorecords.domain.repository.ClassificationStatistics(
            r.analysis.classification, COUNT(r), AVG(r.analysis.confidence), AVG(r.analysis.heartRate))
        FROM ProtectedRecord r
        WHERE r.ownerId = :ownerId
        GROUP BY r.analysis.classification
        ORDER BY COUNT(r) DESC
        """)
    List<ClassificationStatistics> statisticsByOwner(@Param("ownerId") UUID ownerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ProtectedRecord r WHERE r.id = :id AND r.ownerId = :ownerId")
    int deleteOwned(@Param("id") UUID id, @Param("ownerId") UUID ownerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ProtectedRecord r WHERE r.ownerId = :ownerId")
    int deleteAllOwned(@Param("ownerId") UUID ownerId);
}
