package com.cardiorecords.application.exceptions;

/**
 * Stable error codes returned to API clients, with their HTTP status and the
 * only message a client is ever shown for them.
 */
public enum ErrorCode {
    INVALID_CREDENTIALS(401, "Invalid credentials."),
    ACCOUNT_LOCKED(423, "Account is temporarily locked. Please try again later."),
    ACCOUNT_DEACTIVATED(401, "Account is deactivated."),
    TOKEN_INVALID(401, "Invalid token."),
    TOKEN_EXPIRED(401, "Token expired. Please login again."),
    AUTHENTICATION_REQUIRED(401, "Authentication required."),
    FORBIDDEN(403, "Access denied. Insufficient permissions."),
    NOT_FOUND(404, "Record not found."),
    METHOD_NOT_ALLOWED(405, "Method not allowed."),
    CONFLICT(409, "Email already registered."),
    VALIDATION_FAILED(400, "Invalid request parameters."),
    PAYLOAD_TOO_LARGE(413, "File too large. Maximum size is 50MB."),
    RECORD_RETRIEVAL_FAILED(500, "Failed to retrieve record."),
    INTERNAL_ERROR(500, "An unexpected error occurred. Please contact support.");

    private final int status;
    private final String defaultMessage;

    ErrorCode(int status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public int status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
