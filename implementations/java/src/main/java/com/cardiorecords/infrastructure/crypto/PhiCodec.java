package com.cardiorecords.infrastructure.crypto;

import com.cardiorecords.application.exceptions.CryptoException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Applies the {@link EnvelopeCipher} to structured clinical payloads.
 *
 * <p>The integrity hash covers the raw artifact bytes. It is computed when a
 * record is sealed and compared again, in constant time, after every decrypt.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PhiCodec {

    private final EnvelopeCipher cipher;
    private final ObjectMapper objectMapper;

    public SealedRecord seal(RecordPayload payload) {
        byte[] data = payload.getData();
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("Artifact bytes must not be empty");
        }
        String integrityHash = fingerprint(data);
        byte[] serialized;
        try {
            serialized = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new CryptoException(CryptoException.Reason.PROVIDER_FAILURE, "Failed to serialize payload", e);
        }
        String blob = cipher.encrypt(serialized).toBase64();
        log.debug("Sealed payload: integrityHash={}, size={}", integrityHash, data.length);
        return new SealedRecord(blob, integrityHash, data.length);
    }

    /**
     * Decrypts a stored blob and checks the artifact against its recorded hash.
     *
     * @throws CryptoException MALFORMED_BLOB or INTEGRITY_FAILURE
     */
    public RecordPayload open(String encryptedPayload, String expectedHash) {
        byte[] plaintext = cipher.decrypt(EncryptedPayload.fromBase64(encryptedPayload));
        RecordPayload payload;
        try {
            payload = objectMapper.readValue(plaintext, RecordPayload.class);
        } catch (IOException e) {
            throw new CryptoException(CryptoException.Reason.MALFORMED_BLOB, "Decrypted payload is not readable", e);
        }
        if (payload.getData() == null || !verifyIntegrity(payload.getData(), expectedHash)) {
            log.warn("Integrity hash mismatch on decrypted payload: expected={}", expectedHash);
            throw new CryptoException(CryptoException.Reason.INTEGRITY_FAILURE, "Integrity hash mismatch");
        }
        return payload;
    }

    public String fingerprint(byte[] data) {
        return cipher.digest(data);
    }

    public boolean verifyIntegrity(byte[] data, String expectedHash) {
        if (expectedHash == null) {
            return false;
        }
        return MessageDigest.isEqual(
            fingerprint(data).getBytes(StandardCharsets.US_ASCII),
            expectedHash.getBytes(StandardCharsets.US_ASCII));
    }
}
