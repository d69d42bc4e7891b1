package com.cardiorecords.domain.repository;

import com.cardiorecords.domain.model.Principal;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Credential store for {@link Principal} accounts.
 *
 * <p>Lockout bookkeeping is exposed as single atomic operations; callers must
 * not emulate them with a read followed by {@link #save(Principal)}. Each
 * operation commits before it returns.
 */
public interface PrincipalRepository {

    Optional<Principal> findById(UUID id);

    /**
     * @param normalizedEmail email as produced by {@link Principal#normalizeEmail(String)}
     */
    Optional<Principal> findByEmail(String normalizedEmail);

    boolean existsByEmail(String normalizedEmail);

    Principal save(Principal principal);

    /**
     * Counts one failed login, in one conditional update.
     *
     * <p>Applies only while the account is not locked at {@code now}. If a
     * previous lock has elapsed the counter restarts at one. When the new count
     * reaches {@code threshold} the lock is set to {@code lockUntil}.
     *
     * @return true if the attempt was counted, false if the account was locked
     *         (or does not exist) at {@code now}
     */
    boolean recordFailedAttempt(UUID id, int threshold, Instant now, Instant lockUntil);

    /**
     * Resets counter and lock and stamps the last login, unless the account is
     * locked at {@code now}.
     *
     * @return false if a lock was in force, in which case nothing changed
     */
    boolean recordSuccessfulLogin(UUID id, Instant now);

    /**
     * Administrative unlock: clears counter and lock unconditionally.
     *
     * @return false if no such principal exists
     */
    boolean clearLockout(UUID id, Instant now);
}
