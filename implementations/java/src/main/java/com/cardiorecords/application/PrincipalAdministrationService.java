package com.cardiorecords.application;

import com.cardiorecords.application.exceptions.ResourceNotFoundException;
import com.cardiorecords.domain.model.Principal;
import com.cardiorecords.domain.model.Role;
import com.cardiorecords.domain.repository.PrincipalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Administrative changes to other principals. Role checks happen at the
 * audited entry points.
 *
 * Changes load and modify the entity in one transaction so only the dirty
 * columns are written and the lockout columns are left alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PrincipalAdministrationService {

    private final PrincipalRepository principals;
    private final Clock clock;

    @Transactional
    public Principal changeRole(UUID principalId, Role role) {
        Principal principal = load(principalId);
        Role previous = principal.getRole();
        principal.changeRole(role, clock.instant());
        Principal saved = principals.save(principal);
        log.warn("Role changed: principal={}, from={}, to={}", principalId, previous, role);
        return saved;
    }

    @Transactional
    public Principal setActive(UUID principalId, boolean active) {
        Principal principal = load(principalId);
        if (active) {
            principal.activate(clock.instant());
        } else {
            principal.deactivate(clock.instant());
        }
        Principal saved = principals.save(principal);
        log.warn("Principal {}: id={}", active ? "activated" : "deactivated", principalId);
        return saved;
    }

    public Principal unlock(UUID principalId) {
        if (!principals.clearLockout(principalId, clock.instant())) {
            throw ResourceNotFoundException.principal(principalId);
        }
        return load(principalId);
    }

    private Principal load(UUID principalId) {
        return principals.findById(principalId)
            .orElseThrow(() -> ResourceNotFoundException.principal(principalId));
    }
}
