package com.cardiorecords.application.exceptions;

/**
 * Requested resource does not exist or is not visible to the caller.
 */
public class ResourceNotFoundException extends PhiException {

    private final String publicMessage;

    public ResourceNotFoundException(String publicMessage, Object id) {
        super(publicMessage + " id=" + id);
        this.publicMessage = publicMessage;
    }

    public static ResourceNotFoundException record(Object id) {
        return new ResourceNotFoundException(ErrorCode.NOT_FOUND.defaultMessage(), id);
    }

    public static ResourceNotFoundException principal(Object id) {
        return new ResourceNotFoundException("Principal not found.", id);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.NOT_FOUND;
    }

    @Override
    public String getPublicMessage() {
        return publicMessage;
    }
}
