package com.cardiorecords.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Caffeine caches.
 *
 * Security:
 * - Only token ids and expiry instants are cached, never tokens or PHI
 * - Each revoked token id expires at its token's own expiry
 * - A size eviction makes a logged-out token valid again until it expires, so
 *   every one is logged and counted on {@code phi.token.revocation.evictions}
 */
@Configuration
@Slf4j
public class CacheConfiguration {

    private static final long MAX_REVOKED_TOKENS = 100_000;

    /**
     * Revoked token ids mapped to the instant their token expires.
     */
    @Bean(name = "revokedTokenCache")
    public Cache<String, Instant> revokedTokenCache(Clock clock, MeterRegistry meterRegistry) {
        log.info("Configuring token revocation cache: maximumSize={}", MAX_REVOKED_TOKENS);
        return revocationCache(clock, meterRegistry, MAX_REVOKED_TOKENS);
    }

    static Cache<String, Instant> revocationCache(Clock clock, MeterRegistry meterRegistry, long maximumSize) {
        Counter evictions = Counter.builder("phi.token.revocation.evictions")
            .description("Revoked token ids evicted before their token expired")
            .register(meterRegistry);

        return Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .evictionListener((String tokenId, Instant expiresAt, RemovalCause cause) -> {
                if (cause == RemovalCause.SIZE) {
                    evictions.increment();
                    log.warn("Revocation cache full, revoked token evicted early: tokenId={}, expiresAt={}",
                        tokenId, expiresAt);
                }
            })
            .expireAfter(new Expiry<String, Instant>() {
                @Override
                public long expireAfterCreate(String tokenId, Instant expiresAt, long currentTime) {
                    return remainingNanos(expiresAt, clock);
                }

                @Override
                public long expireAfterUpdate(String tokenId, Instant expiresAt, long currentTime,
                                              long currentDuration) {
                    return remainingNanos(expiresAt, clock);
                }

                @Override
                public long expireAfterRead(String tokenId, Instant expiresAt, long currentTime,
                                            long currentDuration) {
                    return currentDuration;
                }
            })
            .recordStats()
            .build();
    }

    private static long remainingNanos(Instant expiresAt, Clock clock) {
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        return remaining.isNegative() ? 0 : remaining.toNanos();
    }
}
