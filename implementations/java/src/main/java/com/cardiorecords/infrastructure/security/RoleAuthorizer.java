package com.cardiorecords.infrastructure.security;

import com.cardiorecords.domain.model.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Role-membership {@link Authorizer}. Pure function of its inputs: it neither
 * throws nor audits; the audit interceptor turns a deny into an
 * {@code ACCESS_DENIED} entry and a 403.
 */
@Service
@Slf4j
public class RoleAuthorizer implements Authorizer {

    @Override
    public AuthorizationDecision authorize(Role role, Set<Role> requiredRoles) {
        if (role == null) {
            log.debug("AUTHORIZATION DENIED: anonymous caller, required={}", requiredRoles);
            return AuthorizationDecision.deny(null, requiredRoles);
        }
        if (requiredRoles.isEmpty() || requiredRoles.contains(role)) {
            return AuthorizationDecision.allow();
        }
        log.debug("AUTHORIZATION DENIED: role={}, required={}", role, requiredRoles);
        return AuthorizationDecision.deny(role, requiredRoles);
    }
}
