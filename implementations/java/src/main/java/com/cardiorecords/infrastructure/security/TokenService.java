package com.cardiorecords.infrastructure.security;

import com.cardiorecords.application.exceptions.AuthException;

import java.util.UUID;

/**
 * Issues and verifies signed, time-bounded bearer tokens. Tokens are not
 * persisted.
 */
public interface TokenService {

    IssuedToken issue(UUID principalId);

    /**
     * Checks signature, issuer and expiry.
     *
     * @throws AuthException TOKEN_INVALID or TOKEN_EXPIRED
     */
    VerifiedToken verify(String token);
}
