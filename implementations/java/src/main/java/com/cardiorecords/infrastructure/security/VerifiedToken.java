package com.cardiorecords.infrastructure.security;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Claims of a token whose signature and expiry have been checked.
 */
@Value
public class VerifiedToken {
    UUID principalId;
    String tokenId;
    Instant issuedAt;
    Instant expiresAt;
}
