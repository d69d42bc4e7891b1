package com.cardiorecords.infrastructure.security;

import com.cardiorecords.application.exceptions.AuthException;
import com.cardiorecords.infrastructure.audit.AuditInterceptor;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Answers anonymous requests to protected routes with 401
 * {@code AUTHENTICATION_REQUIRED} and records the rejection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final AuditInterceptor auditInterceptor;
    private final ErrorResponseWriter errorResponseWriter;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        AuthException missing = new AuthException(AuthException.Reason.AUTHENTICATION_REQUIRED, authException);
        log.debug("Unauthenticated request rejected: path={}", request.getRequestURI());
        auditInterceptor.recordRejected(request, missing);
        errorResponseWriter.write(request, response, missing);
    }
}
