package com.cardiorecords.application.exceptions;

/**
 * Authentication failure raised by login or token verification.
 */
public class AuthException extends PhiException {

    public enum Reason {
        INVALID_CREDENTIALS(ErrorCode.INVALID_CREDENTIALS),
        ACCOUNT_LOCKED(ErrorCode.ACCOUNT_LOCKED),
        ACCOUNT_DEACTIVATED(ErrorCode.ACCOUNT_DEACTIVATED),
        TOKEN_INVALID(ErrorCode.TOKEN_INVALID),
        TOKEN_EXPIRED(ErrorCode.TOKEN_EXPIRED),
        AUTHENTICATION_REQUIRED(ErrorCode.AUTHENTICATION_REQUIRED);

        private final ErrorCode errorCode;

        Reason(ErrorCode errorCode) {
            this.errorCode = errorCode;
        }
    }

    private final Reason reason;

    public AuthException(Reason reason) {
        super(reason.name());
        this.reason = reason;
    }

    public AuthException(Reason reason, Throwable cause) {
        super(reason.name(), cause);
        this.reason = reason;
    }

    public static AuthException invalidCredentials() {
        return new AuthException(Reason.INVALID_CREDENTIALS);
    }

    public static AuthException accountLocked() {
        return new AuthException(Reason.ACCOUNT_LOCKED);
    }

    public static AuthException accountDeactivated() {
        return new AuthException(Reason.ACCOUNT_DEACTIVATED);
    }

    public static AuthException tokenInvalid() {
        return new AuthException(Reason.TOKEN_INVALID);
    }

    public static AuthException tokenExpired() {
        return new AuthException(Reason.TOKEN_EXPIRED);
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public ErrorCode getErrorCode() {
        return reason.errorCode;
    }
}
