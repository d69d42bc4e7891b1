package com.cardiorecords.application;

import com.cardiorecords.application.exceptions.AuthException;
import com.cardiorecords.config.PhiSecurityProperties;
import com.cardiorecords.domain.model.Principal;
import com.cardiorecords.domain.repository.PrincipalRepository;
import com.cardiorecords.infrastructure.security.IssuedToken;
import com.cardiorecords.infrastructure.security.PasswordVerifier;
import com.cardiorecords.infrastructure.security.SecurityContext;
import com.cardiorecords.infrastructure.security.TokenRevocationList;
import com.cardiorecords.infrastructure.security.TokenService;
import com.cardiorecords.infrastructure.security.VerifiedToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Credential check, lockout state machine and token lifecycle.
 *
 * Lockout:
 * - A lock in force rejects the attempt before any hash comparison
 * - A mismatch is counted by one conditional update in the credential store;
 *   the update that reaches the threshold sets the lock
 * - A match resets counter and lock in one conditional update, which fails if
 *   a concurrent mismatch locked the account in the meantime
 *
 * Not {@code @Transactional}: each store operation commits on its
 * own, so a counted failure survives the exception thrown afterwards.
 */
@Service
@Slf4j
public class Authenticator {

    private final PrincipalRepository principals;
    private final PasswordVerifier passwordVerifier;
    private final TokenService tokenService;
    private final TokenRevocationList revocationList;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration lockDuration;

    public Authenticator(PrincipalRepository principals,
                         PasswordVerifier passwordVerifier,
                         TokenService tokenService,
                         TokenRevocationList revocationList,
                         PhiSecurityProperties properties,
                         Clock clock) {
        this.principals = principals;
        this.passwordVerifier = passwordVerifier;
        this.tokenService = tokenService;
        this.revocationList = revocationList;
        this.clock = clock;
        this.maxAttempts = properties.getLockout().getMaxAttempts();
        this.lockDuration = properties.getLockout().getDuration();
    }

    /**
     * @throws AuthException INVALID_CREDENTIALS, ACCOUNT_LOCKED or ACCOUNT_DEACTIVATED
     */
    public AuthenticationResult login(String identifier, String secret) {
        Optional<Principal> found = identifier == null || identifier.isBlank()
            ? Optional.empty()
            : principals.findByEmail(Principal.normalizeEmail(identifier));

        if (found.isEmpty()) {
            passwordVerifier.dummyCompare(secret);
            log.info("Login failed: unknown identifier {}", maskEmail(identifier));
            throw AuthException.invalidCredentials();
        }

        Principal principal = found.get();
        Instant now = clock.instant();

        if (principal.isLockedAt(now)) {
            log.warn("Login rejected, account locked: principal={}, until={}",
                principal.getId(), principal.getLockUntil());
            throw AuthException.accountLocked();
        }
        if (!principal.isActive()) {
            log.warn("Login rejected, account deactivated: principal={}", principal.getId());
            throw AuthException.accountDeactivated();
        }

        if (!passwordVerifier.matches(secret, principal.getPasswordHash())) {
            boolean counted = principals.recordFailedAttempt(
                principal.getId(), maxAttempts, now, now.plus(lockDuration));
            log.warn("Login failed: principal={}, counted={}", principal.getId(), counted);
            throw AuthException.invalidCredentials();
        }

        if (!principals.recordSuccessfulLogin(principal.getId(), now)) {
            log.warn("Login rejected, account locked concurrently: principal={}", principal.getId());
            throw AuthException.accountLocked();
        }

        IssuedToken token = tokenService.issue(principal.getId());
        Principal current = principals.findById(principal.getId()).orElse(principal);
        log.info("Login succeeded: principal={}, tokenId={}", current.getId(), token.getTokenId());
        return new AuthenticationResult(current, token);
    }

    /**
     * Verifies a bearer token and re-checks the principal it names.
     *
     * @throws AuthException TOKEN_INVALID, TOKEN_EXPIRED, ACCOUNT_LOCKED or ACCOUNT_DEACTIVATED
     */
    public SecurityContext verify(String token) {
        VerifiedToken verified = tokenService.verify(token);

        if (revocationList.isRevoked(verified.getTokenId())) {
            log.debug("Token rejected, revoked: tokenId={}", verified.getTokenId());
            throw AuthException.tokenInvalid();
        }

        Principal principal = principals.findById(verified.getPrincipalId())
            .orElseThrow(AuthException::tokenInvalid);

        if (!principal.isActive()) {
            throw AuthException.accountDeactivated();
        }
        if (principal.isLockedAt(clock.instant())) {
            throw AuthException.accountLocked();
        }
        // JWT iat has second resolution
        if (verified.getIssuedAt().isBefore(principal.getPasswordChangedAt().truncatedTo(ChronoUnit.SECONDS))) {
            log.debug("Token rejected, issued before password change: principal={}", principal.getId());
            throw AuthException.tokenInvalid();
        }

        return SecurityContext.builder()
            .principalId(principal.getId())
            .role(principal.getRole())
            .tokenId(verified.getTokenId())
            .tokenIssuedAt(verified.getIssuedAt())
            .tokenExpiresAt(verified.getExpiresAt())
            .build();
    }

    /**
     * Revokes the token the context was established from until it expires.
     */
    public void logout(SecurityContext context) {
        revocationList.revoke(context.getTokenId(), context.getTokenExpiresAt());
        log.info("Logout: principal={}, tokenId={}", context.getPrincipalId(), context.getTokenId());
    }

    IssuedToken issueToken(Principal principal) {
        return tokenService.issue(principal.getId());
    }

    static String maskEmail(String email) {
        String trimmed = email == null ? "" : email.trim();
        if (trimmed.length() < 3) {
            return "***";
        }
        int atIndex = trimmed.indexOf('@');
        if (atIndex > 0) {
            return trimmed.charAt(0) + "***" + trimmed.substring(atIndex);
        }
        return trimmed.charAt(0) + "***";
    }
}
