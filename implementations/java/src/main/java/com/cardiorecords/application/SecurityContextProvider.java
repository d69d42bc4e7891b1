package com.cardiorecords.application;

import com.cardiorecords.application.exceptions.AuthException;
import com.cardiorecords.infrastructure.security.BearerAuthenticationToken;
import com.cardiorecords.infrastructure.security.SecurityContext;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Provider for current security context from Spring Security.
 *
 * The bearer token filter stores our {@link SecurityContext} as the principal
 * of a {@link BearerAuthenticationToken}; anything else counts as anonymous.
 */
@Component
public class SecurityContextProvider {

    public Optional<SecurityContext> findCurrentContext() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication instanceof BearerAuthenticationToken && authentication.isAuthenticated()) {
            return Optional.of(((BearerAuthenticationToken) authentication).getPrincipal());
        }
        return Optional.empty();
    }

    /**
     * @throws AuthException AUTHENTICATION_REQUIRED when the request is anonymous
     */
    public SecurityContext getCurrentContext() {
        return findCurrentContext()
            .orElseThrow(() -> new AuthException(AuthException.Reason.AUTHENTICATION_REQUIRED));
    }
}
