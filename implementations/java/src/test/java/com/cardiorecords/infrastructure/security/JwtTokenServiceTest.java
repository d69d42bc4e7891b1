package com.cardiorecords.infrastructure.security;

import com.cardiorecords.application.exceptions.AuthException;
import com.cardiorecords.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JwtTokenServiceTest {

    private static final String SECRET = "jwt-test-signing-secret-0123456789abcdef";
    private static final Duration EXPIRY = Duration.ofHours(1);
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private JwtTokenService tokenService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        tokenService = new JwtTokenService(SECRET, EXPIRY, "cardio-records", clock);
    }

    @Test
    void issued_token_verifies_to_its_claims() {
        UUID principalId = UUID.randomUUID();
        IssuedToken issued = tokenService.issue(principalId);

        clock.advance(Duration.ofSeconds(1));
        VerifiedToken verified = tokenService.verify(issued.getValue());

        assertEquals(principalId, verified.getPrincipalId());
        assertEquals(issued.getTokenId(), verified.getTokenId());
        assertEquals(T0, verified.getIssuedAt());
        assertEquals(T0.plus(EXPIRY), verified.getExpiresAt());
    }

    @Test
    void token_ids_are_unique() {
        UUID principalId = UUID.randomUUID();

        assertNotEquals(tokenService.issue(principalId).getTokenId(), tokenService.issue(principalId).getTokenId());
    }

    @Test
    void token_is_accepted_at_expiry_instant() {
        IssuedToken issued = tokenService.issue(UUID.randomUUID());

        clock.set(issued.getExpiresAt());

        assertNotNull(tokenService.verify(issued.getValue()));
    }

    @Test
    void token_past_expiry_is_expired() {
        IssuedToken issued = tokenService.issue(UUID.randomUUID());

        clock.advance(EXPIRY.plusSeconds(1));

        AuthException ex = assertThrows(AuthException.class, () -> tokenService.verify(issued.getValue()));
        assertEquals(AuthException.Reason.TOKEN_EXPIRED, ex.getReason());
    }

    @Test
    void token_signed_with_other_secret_is_invalid() {
        JwtTokenService foreign = new JwtTokenService("another-signing-secret-0123456789abcdef", EXPIRY,
            "cardio-records", clock);
        IssuedToken issued = foreign.issue(UUID.randomUUID());

        AuthException ex = assertThrows(AuthException.class, () -> tokenService.verify(issued.getValue()));
        assertEquals(AuthException.Reason.TOKEN_INVALID, ex.getReason());
    }

    @Test
    void token_from_other_issuer_is_invalid() {
        JwtTokenService otherIssuer = new JwtTokenService(SECRET, EXPIRY, "somebody-else", clock);
        IssuedToken issued = otherIssuer.issue(UUID.randomUUID());

        AuthException ex = assertThrows(AuthException.class, () -> tokenService.verify(issued.getValue()));
        assertEquals(AuthException.Reason.TOKEN_INVALID, ex.getReason());
    }

    @Test
    void tampered_payload_is_invalid() {
        String[] parts = tokenService.issue(UUID.randomUUID()).getValue().split("\\.");
        String forged = tokenService.issue(UUID.randomUUID()).getValue().split("\\.")[1];
        String token = parts[0] + "." + forged + "." + parts[2];

        AuthException ex = assertThrows(AuthException.class, () -> tokenService.verify(token));
        assertEquals(AuthException.Reason.TOKEN_INVALID, ex.getReason());
    }

    @Test
    void garbage_and_blank_tokens_are_invalid() {
        assertEquals(AuthException.Reason.TOKEN_INVALID,
            assertThrows(AuthException.class, () -> tokenService.verify("not-a-jwt")).getReason());
        assertEquals(AuthException.Reason.TOKEN_INVALID,
            assertThrows(AuthException.class, () -> tokenService.verify("")).getReason());
        assertEquals(AuthException.Reason.TOKEN_INVALID,
            assertThrows(AuthException.class, () -> tokenService.verify(null)).getReason());
    }

    @Test
    void short_signing_secret_is_rejected_at_construction() {
        assertThrows(IllegalStateException.class,
            () -> new JwtTokenService("too-short", EXPIRY, "cardio-records", clock));
        assertThrows(IllegalStateException.class,
            () -> new JwtTokenService(null, EXPIRY, "cardio-records", clock));
    }
}
