package com.cardiorecords.infrastructure.persistence;

import com.cardiorecords.domain.model.Principal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for {@link Principal}.
 *
 * The lockout updates are conditional statements so the database row lock
 * serializes concurrent login attempts against one account. A failed attempt
 * runs {@link #incrementBelowThreshold} and, when that matches no row,
 * {@link #incrementAndLock}; the two conditions never hold together.
 */
@Repository
public interface SpringDataPrincipalRepository extends JpaRepository<Principal, UUID> {

    Optional<Principal> findByEmail(String email);

    boolean existsByEmail(String email);

    /**
     * Counts a failure that stays below the threshold. An expired lock restarts
     * the count at one.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Principal p SET
            p.failedAttempts = CASE WHEN p.lockUntil IS NULL THEN p.failedAttempts + 1 ELSE 1 END,
            p.lockUntil = NULL,
            p.updatedAt = :now
        WHERE p.id = :id
          AND ((p.lockUntil IS NULL AND p.failedAttempts + 1 < :threshold)
            OR (p.lockUntil <= :now AND 1 < :threshold))
        """)
    int incrementBelowThreshold(@Param("id") UUID id,
                                @Param("threshold") int threshold,
                                @Param("now") Instant now);

    /**
     * Counts the failure that reaches the threshold and sets the lock. Matches
     * no row while a lock is in force, so the lock is set once.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Principal p SET
            p.failedAttempts = CASE WHEN p.lockUntil IS NULL THEN p.failedAttempts + 1 ELSE 1 END,
            p.lockUntil = :lockUntil,
            p.updatedAt = :now
        WHERE p.id = :id
          AND ((p.lockUntil IS NULL AND p.failedAttempts + 1 >= :threshold)
            OR (p.lockUntil <= :now AND 1 >= :threshold))
        """)
    int incrementAndLock(@Param("id") UUID id,
                         @Param("threshold") int threshold,
                         @Param("now") Instant now,
                         @Param("lockUntil") Instant lockUntil);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Principal p SET
            p.failedAttempts = 0,
            p.lockUntil = NULL,
            p.lastLoginAt = :now,
            p.updatedAt = :now
        WHERE p.id = :id AND (p.lockUntil IS NULL OR p.lockUntil <= :now)
        """)
    int resetAfterSuccessfulLogin(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Principal p SET p.failedAttempts = 0, p.lockUntil = NULL, p.updatedAt = :now
        WHERE p.id = :id
        """)
    int clearLockout(@Param("id") UUID id, @Param("now") Instant now);
}
