package com.cardiorecords.infrastructure.crypto;

import com.cardiorecords.application.exceptions.CryptoException;

/**
 * Authenticated symmetric encryption of opaque bytes under the service key.
 *
 * <p>Implementations are stateless apart from the immutable key and safe for
 * concurrent use.
 */
public interface EnvelopeCipher {

    /**
     * Encrypt with a fresh random nonce.
     *
     * @param plaintext bytes to protect
     * @return nonce, tag and ciphertext
     */
    EncryptedPayload encrypt(byte[] plaintext);

    /**
     * Decrypt and authenticate. Never returns partial plaintext.
     *
     * @throws CryptoException with {@link CryptoException.Reason#INTEGRITY_FAILURE}
     *         when the tag does not verify
     */
    byte[] decrypt(EncryptedPayload payload);

    /**
     * Unkeyed SHA-256 of {@code data} as lowercase hex.
     */
    String digest(byte[] data);
}
