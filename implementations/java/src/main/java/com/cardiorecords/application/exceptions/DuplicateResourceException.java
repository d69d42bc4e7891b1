package com.cardiorecords.application.exceptions;

/**
 * Thrown when attempting to create a resource that already exists.
 */
public class DuplicateResourceException extends PhiException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.CONFLICT;
    }
}
