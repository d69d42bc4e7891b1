package com.cardiorecords.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of one access attempt.
 *
 * <p>Mapped as {@link Immutable}: Hibernate never issues an UPDATE for it and
 * no repository exposes a delete.
 */
@Entity
@Immutable
@Table(name = "audit_entries", indexes = {
    @Index(name = "ix_audit_actor_time", columnList = "actor_id, occurred_at"),
    @Index(name = "ix_audit_action_time", columnList = "action, occurred_at"),
    @Index(name = "ix_audit_resource", columnList = "resource_kind, resource_id, occurred_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class AuditEntry {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    /**
     * Null for anonymous callers and failed authentication.
     */
    @Column(name = "actor_id", updatable = false)
    private UUID actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_role", updatable = false, length = 16)
    private Role actorRole;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 32)
    private AuditAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "resource_kind", nullable = false, updatable = false, length = 16)
    private ResourceKind resourceKind;

    @Column(name = "resource_id", updatable = false, length = 64)
    private String resourceId;

    @Embedded
    private RequestMetadata request;

    @Embedded
    private AuditOutcome outcome;

    // converted to JSON text by AuditMetadataConverter (auto-applied)
    @Column(name = "metadata", updatable = false, length = 4000)
    private AuditMetadata metadata;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Override
    public String toString() {
        return "AuditEntry[id=" + id + ", action=" + action + ", resource=" + resourceKind + "/" + resourceId
            + ", actor=" + actorId + ", outcome=" + outcome + "]";
    }
}
