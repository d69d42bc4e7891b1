package com.cardiorecords.application;

import com.cardiorecords.application.exceptions.AuthException;
import com.cardiorecords.config.PhiSecurityProperties;
import com.cardiorecords.domain.model.Principal;
import com.cardiorecords.domain.model.Role;
import com.cardiorecords.domain.repository.PrincipalRepository;
import com.cardiorecords.infrastructure.security.IssuedToken;
import com.cardiorecords.infrastructure.security.PasswordVerifier;
import com.cardiorecords.infrastructure.security.SecurityContext;
import com.cardiorecords.infrastructure.security.TokenRevocationList;
import com.cardiorecords.infrastructure.security.TokenService;
import com.cardiorecords.infrastructure.security.VerifiedToken;
import com.cardiorecords.support.MutableClock;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthenticatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String EMAIL = "clinician@example.com";
    private static final String HASH = "$2a$04$stored";

    @Mock
    private PrincipalRepository principals;

    @Mock
    private PasswordVerifier passwordVerifier;

    @Mock
    private TokenService tokenService;

    private MutableClock clock;
    private TokenRevocationList revocationList;
    private Authenticator authenticator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        PhiSecurityProperties properties = new PhiSecurityProperties();
        revocationList = new TokenRevocationList(
            Caffeine.newBuilder().<String, Instant>build(), properties, clock);
        authenticator = new Authenticator(principals, passwordVerifier, tokenService, revocationList,
            properties, clock);
    }

    private Principal principal() {
        return Principal.register(EMAIL, HASH, "Dr. Heart", NOW.minus(Duration.ofDays(1)));
    }

    private IssuedToken token(Principal principal) {
        return new IssuedToken("signed", UUID.randomUUID().toString(), NOW, NOW.plus(Duration.ofDays(7)));
    }

    @Nested
    class Login {

        @Test
        void unknown_identifier_runs_dummy_compare_and_fails_uniformly() {
            when(principals.findByEmail(EMAIL)).thenReturn(Optional.empty());

            AuthException ex = assertThrows(AuthException.class, () -> authenticator.login(EMAIL, "Secret1!"));

            assertEquals(AuthException.Reason.INVALID_CREDENTIALS, ex.getReason());
            verify(passwordVerifier).dummyCompare("Secret1!");
            verify(principals, never()).recordFailedAttempt(any(), anyInt(), any(), any());
        }

        @Test
        void identifier_is_normalized_before_lookup() {
            when(principals.findByEmail(EMAIL)).thenReturn(Optional.empty());

            assertThrows(AuthException.class, () -> authenticator.login("  Clinician@Example.COM ", "x"));

            verify(principals).findByEmail(EMAIL);
        }

        @Test
        void wrong_password_counts_failure_with_lock_window() {
            Principal principal = principal();
            when(principals.findByEmail(EMAIL)).thenReturn(Optional.of(principal));
            when(passwordVerifier.matches("wrong", HASH)).thenReturn(false);

            AuthException ex = assertThrows(AuthException.class, () -> authenticator.login(EMAIL, "wrong"));

            assertEquals(AuthException.Reason.INVALID_CREDENTIALS, ex.getReason());
            verify(principals).recordFailedAttempt(principal.getId(), 5, NOW, NOW.plus(Duration.ofMinutes(30)));
            verify(tokenService, never()).issue(any());
        }

        @Test
        void locked_account_is_rejected_before_password_check() {
            Principal principal = principal();
            ReflectionTestUtils.setField(principal, "lockUntil", NOW.plus(Duration.ofMinutes(10)));
            when(principals.findByEmail(EMAIL)).thenReturn(Optional.of(principal));

            AuthException ex = assertThrows(AuthException.class, () -> authenticator.login(EMAIL, "Secret1!"));

            assertEquals(AuthException.Reason.ACCOUNT_LOCKED, ex.getReason());
            verify(passwordVerifier, never()).matches(anyString(), anyString());
        }

        @Test
        void deactivated_account_is_rejected() {
            Principal principal = principal();
            principal.deactivate(NOW);
            when(principals.findByEmail(EMAIL)).thenReturn(Optional.of(principal));

            AuthException ex = assertThrows(AuthException.class, () -> authenticator.login(EMAIL, "Secret1!"));

            assertEquals(AuthException.Reason.ACCOUNT_DEACTIVATED, ex.getReason());
        }

        @Test
        void success_resets_lockout_and_issues_token() {
            Principal principal = principal();
            IssuedToken issued = token(principal);
            when(principals.findByEmail(EMAIL)).thenReturn(Optional.of(principal));
            when(passwordVerifier.matches("Secret1!", HASH)).thenReturn(true);
            when(principals.recordSuccessfulLogin(principal.getId(), NOW)).thenReturn(true);
            when(principals.findById(principal.getId())).thenReturn(Optional.of(principal));
            when(tokenService.issue(principal.getId())).thenReturn(issued);

            AuthenticationResult result = authenticator.login(EMAIL, "Secret1!");

            assertSame(issued, result.getToken());
            assertEquals(principal.getId(), result.getPrincipal().getId());
        }

        @Test
        void success_losing_race_against_lock_is_rejected() {
            Principal principal = principal();
            when(principals.findByEmail(EMAIL)).thenReturn(Optional.of(principal));
            when(passwordVerifier.matches("Secret1!", HASH)).thenReturn(true);
            when(principals.recordSuccessfulLogin(principal.getId(), NOW)).thenReturn(false);

            AuthException ex = assertThrows(AuthException.class, () -> authenticator.login(EMAIL, "Secret1!"));

            assertEquals(AuthException.Reason.ACCOUNT_LOCKED, ex.getReason());
            verify(tokenService, never()).issue(any());
        }
    }

    @Nested
    class Verify {

        @Test
        void valid_token_yields_context_with_current_role() {
            Principal principal = principal();
            principal.changeRole(Role.ADMIN, NOW);
            VerifiedToken verified = new VerifiedToken(principal.getId(), "jti-1", NOW, NOW.plusSeconds(3600));
            when(tokenService.verify("t")).thenReturn(verified);
            when(principals.findById(principal.getId())).thenReturn(Optional.of(principal));

            SecurityContext context = authenticator.verify("t");

            assertEquals(principal.getId(), context.getPrincipalId());
            assertEquals(Role.ADMIN, context.getRole());
            assertEquals("jti-1", context.getTokenId());
        }

        @Test
        void deactivated_principal_invalidates_live_token() {
            Principal principal = principal();
            principal.deactivate(NOW);
            when(tokenService.verify("t"))
                .thenReturn(new VerifiedToken(principal.getId(), "jti", NOW, NOW.plusSeconds(60)));
            when(principals.findById(principal.getId())).thenReturn(Optional.of(principal));

            AuthException ex = assertThrows(AuthException.class, () -> authenticator.verify("t"));

            assertEquals(AuthException.Reason.ACCOUNT_DEACTIVATED, ex.getReason());
        }

        @Test
        void unknown_principal_is_invalid_token() {
            UUID missing = UUID.randomUUID();
            when(tokenService.verify("t")).thenReturn(new VerifiedToken(missing, "jti", NOW, NOW.plusSeconds(60)));
            when(principals.findById(missing)).thenReturn(Optional.empty());

            AuthException ex = assertThrows(AuthException.class, () -> authenticator.verify("t"));

            assertEquals(AuthException.Reason.TOKEN_INVALID, ex.getReason());
        }

        @Test
        void token_issued_before_password_change_is_invalid() {
            Principal principal = principal();
            principal.changePassword("$2a$04$new", NOW.plusSeconds(5));
            when(tokenService.verify("t"))
                .thenReturn(new VerifiedToken(principal.getId(), "jti", NOW, NOW.plusSeconds(3600)));
            when(principals.findById(principal.getId())).thenReturn(Optional.of(principal));

            AuthException ex = assertThrows(AuthException.class, () -> authenticator.verify("t"));

            assertEquals(AuthException.Reason.TOKEN_INVALID, ex.getReason());
        }

        @Test
        void logged_out_token_is_rejected_without_store_lookup() {
            UUID principalId = UUID.randomUUID();
            VerifiedToken verified = new VerifiedToken(principalId, "jti-out", NOW, NOW.plusSeconds(3600));
            when(tokenService.verify("t")).thenReturn(verified);

            authenticator.logout(SecurityContext.builder()
                .principalId(principalId)
                .role(Role.USER)
                .tokenId("jti-out")
                .tokenIssuedAt(NOW)
                .tokenExpiresAt(NOW.plusSeconds(3600))
                .build());

            AuthException ex = assertThrows(AuthException.class, () -> authenticator.verify("t"));
            assertEquals(AuthException.Reason.TOKEN_INVALID, ex.getReason());
            verify(principals, never()).findById(eq(principalId));
        }
    }
}
