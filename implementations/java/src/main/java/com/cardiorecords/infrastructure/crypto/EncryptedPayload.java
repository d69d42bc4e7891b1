package com.cardiorecords.infrastructure.crypto;

import com.cardiorecords.application.exceptions.CryptoException;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Serialized AES-GCM envelope: {@code nonce(16) || tag(16) || ciphertext}.
 *
 * <p>Immutable; accessors return copies. {@link #toString()} never prints
 * ciphertext bytes.
 */
public final class EncryptedPayload {

    public static final int NONCE_LENGTH = 16;
    public static final int TAG_LENGTH = 16;

    private final byte[] nonce;
    private final byte[] tag;
    private final byte[] ciphertext;

    public EncryptedPayload(byte[] nonce, byte[] tag, byte[] ciphertext) {
        Objects.requireNonNull(nonce, "Nonce must not be null");
        Objects.requireNonNull(tag, "Tag must not be null");
        Objects.requireNonNull(ciphertext, "Ciphertext must not be null");
        if (nonce.length != NONCE_LENGTH) {
            throw new IllegalArgumentException("AES-256-GCM envelope requires 16-byte nonce");
        }
        if (tag.length != TAG_LENGTH) {
            throw new IllegalArgumentException("AES-256-GCM envelope requires 16-byte tag");
        }
        this.nonce = nonce.clone();
        this.tag = tag.clone();
        this.ciphertext = ciphertext.clone();
    }

    /**
     * Splits a raw blob.
     *
     * @throws CryptoException MALFORMED_BLOB if shorter than nonce plus tag
     */
    public static EncryptedPayload fromBytes(byte[] blob) {
        if (blob == null || blob.length < NONCE_LENGTH + TAG_LENGTH) {
            throw new CryptoException(CryptoException.Reason.MALFORMED_BLOB,
                "Encrypted blob shorter than nonce and tag");
        }
        return new EncryptedPayload(
            Arrays.copyOfRange(blob, 0, NONCE_LENGTH),
            Arrays.copyOfRange(blob, NONCE_LENGTH, NONCE_LENGTH + TAG_LENGTH),
            Arrays.copyOfRange(blob, NONCE_LENGTH + TAG_LENGTH, blob.length));
    }

    /**
     * Parses the stored base64 form.
     *
     * @throws CryptoException MALFORMED_BLOB on bad base64 or short blob
     */
    public static EncryptedPayload fromBase64(String encoded) {
        if (encoded == null) {
            throw new CryptoException(CryptoException.Reason.MALFORMED_BLOB, "Encrypted blob missing");
        }
        byte[] blob;
        try {
            blob = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new CryptoException(CryptoException.Reason.MALFORMED_BLOB, "Encrypted blob is not base64", e);
        }
        return fromBytes(blob);
    }

    public byte[] toBytes() {
        byte[] blob = new byte[nonce.length + tag.length + ciphertext.length];
        System.arraycopy(nonce, 0, blob, 0, nonce.length);
        System.arraycopy(tag, 0, blob, nonce.length, tag.length);
        System.arraycopy(ciphertext, 0, blob, nonce.length + tag.length, ciphertext.length);
        return blob;
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(toBytes());
    }

    public byte[] getNonce() {
        return nonce.clone();
    }

    public byte[] getTag() {
        return tag.clone();
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncryptedPayload)) {
            return false;
        }
        EncryptedPayload that = (EncryptedPayload) o;
        return Arrays.equals(nonce, that.nonce)
            && Arrays.equals(tag, that.tag)
            && Arrays.equals(ciphertext, that.ciphertext);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(nonce);
        result = 31 * result + Arrays.hashCode(tag);
        return 31 * result + Arrays.hashCode(ciphertext);
    }

    @Override
    public String toString() {
        return "EncryptedPayload[algorithm=AES-256-GCM, ciphertextLength=" + ciphertext.length + "]";
    }
}
