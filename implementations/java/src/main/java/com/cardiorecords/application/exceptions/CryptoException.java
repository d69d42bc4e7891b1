package com.cardiorecords.application.exceptions;

/**
 * Envelope cipher failure. Decryption failures never expose which check failed
 * to the client.
 */
public class CryptoException extends PhiException {

    public enum Reason {
        /** Master secret absent at startup. */
        MISSING_KEY,
        /** Authentication tag or integrity hash mismatch. */
        INTEGRITY_FAILURE,
        /** Blob not decodable or too short to hold nonce and tag. */
        MALFORMED_BLOB,
        /** Unexpected provider error. */
        PROVIDER_FAILURE
    }

    private final Reason reason;

    public CryptoException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CryptoException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public ErrorCode getErrorCode() {
        return reason == Reason.MISSING_KEY || reason == Reason.PROVIDER_FAILURE
            ? ErrorCode.INTERNAL_ERROR
            : ErrorCode.RECORD_RETRIEVAL_FAILED;
    }
}
