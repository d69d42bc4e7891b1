package com.cardiorecords.infrastructure.security;

import com.cardiorecords.domain.model.Role;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable security context for an authenticated request.
 *
 * <p>Established by the bearer token filter after the principal has been
 * re-loaded and re-checked.
 */
@Value
@Builder
public class SecurityContext {
    UUID principalId;
    Role role;
    String tokenId;
    Instant tokenIssuedAt;
    Instant tokenExpiresAt;
}
