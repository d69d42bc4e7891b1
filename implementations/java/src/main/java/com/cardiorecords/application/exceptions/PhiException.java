package com.cardiorecords.application.exceptions;

/**
 * Base type for every failure the API maps to a known {@link ErrorCode}.
 *
 * <p>{@link #getMessage()} is for logs. {@link #getPublicMessage()} is what
 * a client sees and never carries internal detail.
 */
public abstract class PhiException extends RuntimeException {

    protected PhiException(String message) {
        super(message);
    }

    protected PhiException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCode getErrorCode();

    public String getPublicMessage() {
        return getErrorCode().defaultMessage();
    }
}
