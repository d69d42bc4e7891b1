package com.cardiorecords.infrastructure.security;

import com.cardiorecords.domain.model.Role;

import java.util.Set;

/**
 * Central authorization decision point.
 */
public interface Authorizer {

    /**
     * @param role role of the authenticated principal, null when anonymous
     * @param requiredRoles roles any one of which grants access; empty means
     *        any authenticated principal
     */
    AuthorizationDecision authorize(Role role, Set<Role> requiredRoles);
}
