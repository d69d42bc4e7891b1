package com.cardiorecords.application.exceptions;

/**
 * Audit entry could not be written. Only ever reported on the alert channel.
 */
public class AuditException extends RuntimeException {

    public AuditException(String message, Throwable cause) {
        super(message, cause);
    }
}
