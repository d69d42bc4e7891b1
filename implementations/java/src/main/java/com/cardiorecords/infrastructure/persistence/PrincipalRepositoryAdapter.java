package com.cardiorecords.infrastructure.persistence;

import com.cardiorecords.domain.model.Principal;
import com.cardiorecords.domain.repository.PrincipalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter implementing the domain {@link PrincipalRepository} with Spring Data JPA.
 *
 * Each method runs in its own transaction so a counted failure is committed
 * even though the caller goes on to throw.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class PrincipalRepositoryAdapter implements PrincipalRepository {

    private final SpringDataPrincipalRepository springDataRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Principal> findById(UUID id) {
        return springDataRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Principal> findByEmail(String normalizedEmail) {
        return springDataRepository.findByEmail(normalizedEmail);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByEmail(String normalizedEmail) {
        return springDataRepository.existsByEmail(normalizedEmail);
    }

    @Override
    public Principal save(Principal principal) {
        Principal saved = springDataRepository.save(principal);
        log.debug("Principal persisted: {}", saved);
        return saved;
    }

    @Override
    public boolean recordFailedAttempt(UUID id, int threshold, Instant now, Instant lockUntil) {
        if (springDataRepository.incrementBelowThreshold(id, threshold, now) > 0) {
            return true;
        }
        if (springDataRepository.incrementAndLock(id, threshold, now, lockUntil) > 0) {
            log.warn("Account locked after {} failed attempts: id={}, lockUntil={}", threshold, id, lockUntil);
            return true;
        }
        log.debug("Failed attempt not counted, account locked: id={}", id);
        return false;
    }

    @Override
    public boolean recordSuccessfulLogin(UUID id, Instant now) {
        return springDataRepository.resetAfterSuccessfulLogin(id, now) > 0;
    }

    @Override
    public boolean clearLockout(UUID id, Instant now) {
        int updated = springDataRepository.clearLockout(id, now);
        if (updated > 0) {
            log.info("Lockout cleared: id={}", id);
        }
        return updated > 0;
    }
}
