package com.cardiorecords.infrastructure.security;

import lombok.Value;

import java.time.Instant;

/**
 * A freshly signed token and the claims it carries.
 */
@Value
public class IssuedToken {
    String value;
    String tokenId;
    Instant issuedAt;
    Instant expiresAt;

    @Override
    public String toString() {
        return "IssuedToken[tokenId=" + tokenId + ", expiresAt=" + expiresAt + "]";
    }
}
