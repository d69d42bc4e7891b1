package com.cardiorecords.application;

import com.cardiorecords.application.exceptions.AuthException;
import com.cardiorecords.application.exceptions.DuplicateResourceException;
import com.cardiorecords.application.exceptions.ResourceNotFoundException;
import com.cardiorecords.domain.model.Principal;
import com.cardiorecords.domain.repository.PrincipalRepository;
import com.cardiorecords.infrastructure.security.IssuedToken;
import com.cardiorecords.infrastructure.security.PasswordVerifier;
import com.cardiorecords.infrastructure.security.SecurityContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Self-service account operations: registration, profile, password change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final PrincipalRepository principals;
    private final PasswordVerifier passwordVerifier;
    private final Authenticator authenticator;
    private final Clock clock;

    public AuthenticationResult register(String email, String password, String displayName) {
        PasswordPolicy.check(password);
        String normalized = Principal.normalizeEmail(email);
        if (principals.existsByEmail(normalized)) {
            throw new DuplicateResourceException("Email already registered.");
        }

        Principal principal = Principal.register(normalized, passwordVerifier.hash(password), displayName,
            clock.instant());
        try {
            principal = principals.save(principal);
        } catch (DataIntegrityViolationException e) {
            // lost a race against a concurrent registration of the same email
            throw new DuplicateResourceException("Email already registered.");
        }

        IssuedToken token = authenticator.issueToken(principal);
        log.info("Principal registered: id={}, email={}", principal.getId(), Authenticator.maskEmail(normalized));
        return new AuthenticationResult(principal, token);
    }

    public Principal currentPrincipal(SecurityContext context) {
        return principals.findById(context.getPrincipalId())
            .orElseThrow(() -> ResourceNotFoundException.principal(context.getPrincipalId()));
    }

    /**
     * Replaces the password and returns a fresh token; tokens issued before the
     * change stop verifying.
     *
     * @throws AuthException INVALID_CREDENTIALS if the current password is wrong
     */
    @Transactional
    public AuthenticationResult changePassword(SecurityContext context, String currentPassword, String newPassword) {
        Principal principal = currentPrincipal(context);
        if (!passwordVerifier.matches(currentPassword, principal.getPasswordHash())) {
            log.warn("Password change rejected, current password mismatch: principal={}", principal.getId());
            throw AuthException.invalidCredentials();
        }
        PasswordPolicy.check(newPassword);

        principal.changePassword(passwordVerifier.hash(newPassword), clock.instant());
        Principal saved = principals.save(principal);
        IssuedToken token = authenticator.issueToken(saved);
        log.info("Password changed: principal={}", saved.getId());
        return new AuthenticationResult(saved, token);
    }
}
