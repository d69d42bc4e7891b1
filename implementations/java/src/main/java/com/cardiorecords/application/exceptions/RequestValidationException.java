package com.cardiorecords.application.exceptions;

/**
 * Business-rule validation failure. The message is safe to show to clients.
 */
public class RequestValidationException extends PhiException {

    public RequestValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.VALIDATION_FAILED;
    }

    @Override
    public String getPublicMessage() {
        return getMessage();
    }
}
