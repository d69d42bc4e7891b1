package com.cardiorecords.infrastructure.security;

import com.cardiorecords.config.PhiSecurityProperties;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Denylist of logged-out token ids, held until each token's own expiry.
 *
 * <p>Single-node scope: entries live in the local Caffeine cache. When
 * revocation is disabled every lookup answers "not revoked".
 */
@Component
@Slf4j
public class TokenRevocationList {

    private final Cache<String, Instant> revokedTokens;
    private final boolean enabled;
    private final Clock clock;

    public TokenRevocationList(@Qualifier("revokedTokenCache") Cache<String, Instant> revokedTokens,
                               PhiSecurityProperties properties,
                               Clock clock) {
        this.revokedTokens = revokedTokens;
        this.enabled = properties.getToken().isRevocationEnabled();
        this.clock = clock;
    }

    public void revoke(String tokenId, Instant expiresAt) {
        if (!enabled) {
            return;
        }
        revokedTokens.put(tokenId, expiresAt);
        log.debug("Token revoked: tokenId={}, until={}", tokenId, expiresAt);
    }

    public boolean isRevoked(String tokenId) {
        if (!enabled) {
            return false;
        }
        Instant until = revokedTokens.getIfPresent(tokenId);
        return until != null && !clock.instant().isAfter(until);
    }
}
