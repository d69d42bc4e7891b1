package com.cardiorecords.interfaces.api.exception;

import com.cardiorecords.application.exceptions.ApiErrorCatalog;
import com.cardiorecords.application.exceptions.AuthException;
import com.cardiorecords.application.exceptions.AuthorizationException;
import com.cardiorecords.application.exceptions.CryptoException;
import com.cardiorecords.application.exceptions.PhiException;
import com.cardiorecords.interfaces.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Every response goes through {@link ApiErrorCatalog}, so status and message
 * match what the audit interceptor records. Internal details (exception
 * messages, stack traces, crypto reasons) are logged and never returned.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    /**
     * Handle validation errors from @Valid request bodies and form binding.
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(BindException ex, HttpServletRequest request) {
        List<ErrorResponse.ValidationError> validationErrors = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> ErrorResponse.ValidationError.builder()
                .field(error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName())
                .message(error.getDefaultMessage())
                .build())
            .collect(Collectors.toList());

        ErrorResponse errorResponse = body(ex, request);
        errorResponse.setValidationErrors(validationErrors);

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                validationErrors.size(), request.getRequestURI());
        }
        return ResponseEntity.status(errorResponse.getStatus()).body(errorResponse);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex,
                                                                   HttpServletRequest request) {
        List<ErrorResponse.ValidationError> validationErrors = ex.getConstraintViolations()
            .stream()
            .map(violation -> ErrorResponse.ValidationError.builder()
                .field(violation.getPropertyPath().toString())
                .message(violation.getMessage())
                .build())
            .collect(Collectors.toList());

        ErrorResponse errorResponse = body(ex, request);
        errorResponse.setValidationErrors(validationErrors);
        return ResponseEntity.status(errorResponse.getStatus()).body(errorResponse);
    }

    /**
     * Authentication failures. The reason is logged; the client sees only the
     * uniform message of its code.
     */
    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ErrorResponse> handleAuth(AuthException ex, HttpServletRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("Authentication failed: reason={} on {}", ex.getReason(), request.getRequestURI());
        }
        return respond(ex, request);
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AuthorizationException ex, HttpServletRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("Access denied: {} on {}", ex.getMessage(), request.getRequestURI());
        }
        return respond(ex, request);
    }

    @ExceptionHandler(CryptoException.class)
    public ResponseEntity<ErrorResponse> handleCrypto(CryptoException ex, HttpServletRequest request) {
        if (log.isErrorEnabled()) {
            log.error("Crypto failure: reason={} on {}", ex.getReason(), request.getRequestURI(), ex);
        }
        return respond(ex, request);
    }

    @ExceptionHandler(PhiException.class)
    public ResponseEntity<ErrorResponse> handleApplication(PhiException ex, HttpServletRequest request) {
        if (log.isDebugEnabled()) {
            log.debug("Request rejected: code={} on {}", ex.getErrorCode(), request.getRequestURI());
        }
        return respond(ex, request);
    }

    /**
     * Handle all other exceptions, framework ones included.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        ResponseEntity<ErrorResponse> response = respond(ex, request);
        if (response.getStatusCode().is5xxServerError()) {
            if (log.isErrorEnabled()) {
                log.error("Unhandled exception on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
            }
        } else if (log.isWarnEnabled()) {
            log.warn("Request failed: {} on {}", ex.getClass().getSimpleName(), request.getRequestURI());
        }
        return response;
    }

    private ResponseEntity<ErrorResponse> respond(Throwable ex, HttpServletRequest request) {
        ErrorResponse errorResponse = body(ex, request);
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(errorResponse.getStatus());
        if (errorResponse.getStatus() == HttpStatus.UNAUTHORIZED.value()) {
            builder.header("WWW-Authenticate", "Bearer");
        }
        return builder.body(errorResponse);
    }

    private ErrorResponse body(Throwable ex, HttpServletRequest request) {
        return ErrorResponse.of(ApiErrorCatalog.resolve(ex), request.getRequestURI(), clock.instant());
    }
}
