package com.cardiorecords.application.exceptions;

import jakarta.persistence.OptimisticLockException;
import jakarta.validation.ConstraintViolationException;
import lombok.Value;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Single mapping from any throwable to the status, code and message a client
 * receives.
 *
 * <p>Used by the controller advice, the bearer filter, the authentication entry
 * point and the audit interceptor, so the status recorded in an audit entry is
 * the status actually returned.
 */
public final class ApiErrorCatalog {

    private ApiErrorCatalog() {
    }

    @Value
    public static class ApiError {
        int status;
        ErrorCode code;
        String message;

        static ApiError of(ErrorCode code) {
            return new ApiError(code.status(), code, code.defaultMessage());
        }
    }

    public static ApiError resolve(Throwable failure) {
        if (failure instanceof PhiException) {
            PhiException phi = (PhiException) failure;
            return new ApiError(phi.getErrorCode().status(), phi.getErrorCode(), phi.getPublicMessage());
        }
        if (failure instanceof BindException
                || failure instanceof ConstraintViolationException
                || failure instanceof MethodArgumentTypeMismatchException
                || failure instanceof MissingServletRequestParameterException
                || failure instanceof MissingServletRequestPartException
                || failure instanceof ServletRequestBindingException
                || failure instanceof HttpMessageNotReadableException
                || failure instanceof HttpMediaTypeNotSupportedException
                || failure instanceof IllegalArgumentException) {
            return ApiError.of(ErrorCode.VALIDATION_FAILED);
        }
        if (failure instanceof NoResourceFoundException) {
            return new ApiError(404, ErrorCode.NOT_FOUND, "Resource not found.");
        }
        if (failure instanceof HttpRequestMethodNotSupportedException) {
            return ApiError.of(ErrorCode.METHOD_NOT_ALLOWED);
        }
        if (failure instanceof MaxUploadSizeExceededException) {
            return ApiError.of(ErrorCode.PAYLOAD_TOO_LARGE);
        }
        if (failure instanceof AccessDeniedException) {
            return ApiError.of(ErrorCode.FORBIDDEN);
        }
        if (failure instanceof AuthenticationException) {
            return ApiError.of(ErrorCode.AUTHENTICATION_REQUIRED);
        }
        if (failure instanceof OptimisticLockException
                || failure instanceof ObjectOptimisticLockingFailureException) {
            return new ApiError(409, ErrorCode.CONFLICT,
                "The resource was modified by another request. Please retry.");
        }
        return ApiError.of(ErrorCode.INTERNAL_ERROR);
    }

    /**
     * Error type recorded in audit metadata: the code for known failures, the
     * simple class name otherwise. Never the exception message.
     */
    public static String errorType(Throwable failure) {
        if (failure instanceof PhiException) {
            return ((PhiException) failure).getErrorCode().name();
        }
        return failure.getClass().getSimpleName();
    }
}
