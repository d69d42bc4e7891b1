package com.cardiorecords.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Clinical artifact record.
 *
 * <p>The raw artifact, its file name and lead labels live only inside
 * {@link #encryptedPayload}, a base64 envelope blob written once at creation.
 * The integrity hash and the {@link AnalysisSummary} stay in the clear.
 */
@Entity
@Table(name = "protected_records", indexes = {
    @Index(name = "ix_records_owner_created", columnList = "owner_id, created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class ProtectedRecord {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "content_type", nullable = false, updatable = false, length = 64)
    private String contentType;

    /**
     * Lowercase hex SHA-256 of the raw upload.
     */
    @Column(name = "integrity_hash", nullable = false, updatable = false, length = 64)
    private String integrityHash;

    @Column(name = "encrypted_payload", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String encryptedPayload;

    @Column(name = "payload_size", nullable = false, updatable = false)
    private long payloadSize;

    @Embedded
    private AnalysisSummary analysis;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private ProtectedRecord(
            UUID id,
            UUID ownerId,
            String contentType,
            String integrityHash,
            String encryptedPayload,
            long payloadSize,
            AnalysisSummary analysis,
            Instant createdAt) {

        this.id = id;
        this.ownerId = ownerId;
        this.contentType = contentType;
        this.integrityHash = integrityHash;
        this.encryptedPayload = encryptedPayload;
        this.payloadSize = payloadSize;
        this.analysis = analysis;
        this.createdAt = createdAt;
    }

    public static ProtectedRecord create(
            UUID ownerId,
            String contentType,
            String integrityHash,
            String encryptedPayload,
            long payloadSize,
            AnalysisSummary analysis,
            Instant now) {

        Objects.requireNonNull(ownerId, "Owner must not be null");
        Objects.requireNonNull(analysis, "Analysis summary must not be null");
        if (integrityHash == null || !integrityHash.matches("^[0-9a-f]{64}$")) {
            throw new IllegalArgumentException("Integrity hash must be 64 lowercase hex characters");
        }
        if (encryptedPayload == null || encryptedPayload.isBlank()) {
            throw new IllegalArgumentException("Encrypted payload must not be empty");
        }
        return new ProtectedRecord(UUID.randomUUID(), ownerId, contentType, integrityHash,
            encryptedPayload, payloadSize, analysis, now);
    }

    public boolean isOwnedBy(UUID principalId) {
        return ownerId.equals(principalId);
    }

    /**
     * Never includes the encrypted payload.
     */
    @Override
    public String toString() {
        return "ProtectedRecord[id=" + id + ", owner=" + ownerId + ", contentType=" + contentType
            + ", hash=" + integrityHash + "]";
    }
}
