package com.cardiorecords.infrastructure.security;

import com.cardiorecords.domain.model.Role;

import java.util.Set;

/**
 * Outcome of a role check.
 */
public final class AuthorizationDecision {

    private static final AuthorizationDecision ALLOW = new AuthorizationDecision(true, null, Set.of());

    private final boolean allowed;
    private final Role actual;
    private final Set<Role> required;

    private AuthorizationDecision(boolean allowed, Role actual, Set<Role> required) {
        this.allowed = allowed;
        this.actual = actual;
        this.required = required;
    }

    public static AuthorizationDecision allow() {
        return ALLOW;
    }

    public static AuthorizationDecision deny(Role actual, Set<Role> required) {
        return new AuthorizationDecision(false, actual, Set.copyOf(required));
    }

    public boolean isAllowed() {
        return allowed;
    }

    public Role getActual() {
        return actual;
    }

    public Set<Role> getRequired() {
        return required;
    }

    @Override
    public String toString() {
        return allowed ? "Allow" : "Deny[actual=" + actual + ", required=" + required + "]";
    }
}
