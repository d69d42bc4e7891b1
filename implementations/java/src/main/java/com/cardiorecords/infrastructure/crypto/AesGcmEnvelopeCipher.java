package com.cardiorecords.infrastructure.crypto;

import com.cardiorecords.application.exceptions.CryptoException;
import com.cardiorecords.config.PhiSecurityProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * AES-256-GCM envelope cipher keyed from an externally supplied master secret.
 *
 * Key handling:
 * - The 256-bit key is derived once, at construction, with PBKDF2-HMAC-SHA256
 *   over the master secret and a fixed versioned salt
 * - A missing master secret fails construction, which stops the application
 *   context from starting
 * - The derived key is immutable and shared by all threads; each call creates
 *   its own {@link Cipher}
 *
 * Blob layout is {@code nonce(16) || tag(16) || ciphertext}. The JDK provider
 * works on {@code ciphertext || tag}, so the tag is moved on the way in and out.
 */
@Service
@Slf4j
public class AesGcmEnvelopeCipher implements EnvelopeCipher {

    static final String KDF_SALT = "cardio-records/phi-kdf/v1";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_BITS = EncryptedPayload.TAG_LENGTH * 8;
    private static final int AES_KEY_BITS = 256;

    private final SecureRandom secureRandom = new SecureRandom();
    private final SecretKey key;

    @Autowired
    public AesGcmEnvelopeCipher(PhiSecurityProperties properties) {
        this(properties.getEncryption().getMasterSecret(), properties.getEncryption().getKdfIterations());
    }

    public AesGcmEnvelopeCipher(String masterSecret, int iterations) {
        this.key = deriveKey(masterSecret, iterations);
        log.info("Envelope cipher initialised: algorithm=AES-256-GCM, kdf=PBKDF2WithHmacSHA256, iterations={}",
            iterations);
    }

    @Override
    public EncryptedPayload encrypt(byte[] plaintext) {
        byte[] nonce = new byte[EncryptedPayload.NONCE_LENGTH];
        secureRandom.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, nonce));

            byte[] ciphertextWithTag = cipher.doFinal(plaintext);
            int ciphertextLength = ciphertextWithTag.length - EncryptedPayload.TAG_LENGTH;

            byte[] ciphertext = new byte[ciphertextLength];
            byte[] tag = new byte[EncryptedPayload.TAG_LENGTH];
            System.arraycopy(ciphertextWithTag, 0, ciphertext, 0, ciphertextLength);
            System.arraycopy(ciphertextWithTag, ciphertextLength, tag, 0, tag.length);

            log.debug("Encrypted {} bytes", plaintext.length);
            return new EncryptedPayload(nonce, tag, ciphertext);
        } catch (GeneralSecurityException e) {
            throw new CryptoException(CryptoException.Reason.PROVIDER_FAILURE, "Failed to encrypt data", e);
        }
    }

    @Override
    public byte[] decrypt(EncryptedPayload payload) {
        byte[] ciphertext = payload.getCiphertext();
        byte[] tag = payload.getTag();
        byte[] ciphertextWithTag = ByteBuffer.allocate(ciphertext.length + tag.length)
            .put(ciphertext)
            .put(tag)
            .array();
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, payload.getNonce()));
            return cipher.doFinal(ciphertextWithTag);
        } catch (AEADBadTagException e) {
            log.warn("Decryption rejected: authentication tag mismatch");
            throw new CryptoException(CryptoException.Reason.INTEGRITY_FAILURE, "Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new CryptoException(CryptoException.Reason.PROVIDER_FAILURE, "Failed to decrypt data", e);
        }
    }

    @Override
    public String digest(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoException(CryptoException.Reason.PROVIDER_FAILURE, "SHA-256 unavailable", e);
        }
    }

    private static SecretKey deriveKey(String masterSecret, int iterations) {
        if (masterSecret == null || masterSecret.isBlank()) {
            throw new CryptoException(CryptoException.Reason.MISSING_KEY,
                "Master secret is not configured (phi.security.encryption.master-secret)");
        }
        PBEKeySpec spec = new PBEKeySpec(masterSecret.toCharArray(),
            KDF_SALT.getBytes(StandardCharsets.UTF_8), iterations, AES_KEY_BITS);
        try {
            byte[] raw = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
            return new SecretKeySpec(raw, "AES");
        } catch (GeneralSecurityException e) {
            throw new CryptoException(CryptoException.Reason.PROVIDER_FAILURE, "Key derivation failed", e);
        } finally {
            spec.clearPassword();
        }
    }
}
