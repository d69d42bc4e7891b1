package com.cardiorecords.infrastructure.crypto;

import lombok.Value;

/**
 * Result of sealing a {@link RecordPayload}: what gets persisted.
 */
@Value
public class SealedRecord {
    /** base64 of nonce, tag and ciphertext */
    String encryptedPayload;
    /** lowercase hex SHA-256 of the raw artifact bytes */
    String integrityHash;
    long payloadSize;

    @Override
    public String toString() {
        return "SealedRecord[integrityHash=" + integrityHash + ", payloadSize=" + payloadSize + "]";
    }
}
