package com.cardiorecords.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Registered account and its lockout state.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>Email is stored normalized (trimmed, lower-case) and is unique</li>
 *   <li>A {@code lockUntil} in the future blocks every authentication attempt</li>
 *   <li>Failed-attempt counter and lock are only changed through the atomic
 *       repository operations, never by read-modify-write on this entity</li>
 *   <li>Accounts are deactivated, not deleted</li>
 *   <li>Entity updates write dirty columns only; modify a managed instance
 *       so the lockout columns are not rewritten</li>
 * </ul>
 */
@Entity
@DynamicUpdate
@Table(name = "principals", indexes = {
    @Index(name = "ux_principals_email", columnList = "email", unique = true)
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class Principal {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "email", nullable = false, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private Role role;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "failed_attempts", nullable = false)
    private int failedAttempts;

    @Column(name = "lock_until")
    private Instant lockUntil;

    @Column(name = "last_login_at")
    private Instant lastLoginAt;

    @Column(name = "password_changed_at", nullable = false)
    private Instant passwordChangedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    private Principal(UUID id, String email, String passwordHash, String displayName, Role role, Instant now) {
        this.id = id;
        this.email = email;
        this.passwordHash = passwordHash;
        this.displayName = displayName;
        this.role = role;
        this.active = true;
        this.failedAttempts = 0;
        this.passwordChangedAt = now;
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * Creates a new active account with the {@link Role#USER} role.
     *
     * @param email raw email, normalized here
     * @param passwordHash one-way hash produced by the password verifier
     * @param displayName display name
     * @param now creation time
     */
    public static Principal register(String email, String passwordHash, String displayName, Instant now) {
        Objects.requireNonNull(passwordHash, "Password hash must not be null");
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("Display name must not be blank");
        }
        return new Principal(UUID.randomUUID(), normalizeEmail(email), passwordHash,
            displayName.trim(), Role.USER, now);
    }

    public static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email must not be blank");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    public boolean isLockedAt(Instant now) {
        return lockUntil != null && lockUntil.isAfter(now);
    }

    public void changePassword(String newPasswordHash, Instant now) {
        this.passwordHash = Objects.requireNonNull(newPasswordHash, "Password hash must not be null");
        this.passwordChangedAt = now;
        this.updatedAt = now;
    }

    public void changeRole(Role newRole, Instant now) {
        this.role = Objects.requireNonNull(newRole, "Role must not be null");
        this.updatedAt = now;
    }

    public void deactivate(Instant now) {
        this.active = false;
        this.updatedAt = now;
    }

    public void activate(Instant now) {
        this.active = true;
        this.updatedAt = now;
    }

    @Override
    public String toString() {
        return "Principal[id=" + id + ", role=" + role + ", active=" + active + "]";
    }
}
