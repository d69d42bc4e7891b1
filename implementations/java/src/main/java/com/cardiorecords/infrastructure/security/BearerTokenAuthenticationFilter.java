package com.cardiorecords.infrastructure.security;

import com.cardiorecords.application.Authenticator;
import com.cardiorecords.application.exceptions.AuthException;
import com.cardiorecords.infrastructure.audit.AuditInterceptor;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Set;

/**
 * Verifies {@code Authorization: Bearer} tokens and establishes the
 * {@link SecurityContext}.
 *
 * A request without a token passes through anonymously; protected routes then
 * reach the authentication entry point. A request with a token that fails
 * verification is answered here, with one {@code ACCESS_DENIED} audit entry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final Set<String> PUBLIC_PATHS = Set.of("/api/auth/login", "/api/auth/register");

    private final Authenticator authenticator;
    private final AuditInterceptor auditInterceptor;
    private final ErrorResponseWriter errorResponseWriter;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return PUBLIC_PATHS.contains(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || header.isBlank()) {
            chain.doFilter(request, response);
            return;
        }

        try {
            if (!header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
                throw AuthException.tokenInvalid();
            }
            SecurityContext context = authenticator.verify(header.substring(BEARER_PREFIX.length()).trim());
            SecurityContextHolder.getContext().setAuthentication(new BearerAuthenticationToken(context));
        } catch (AuthException e) {
            SecurityContextHolder.clearContext();
            log.info("Bearer token rejected: reason={}, path={}", e.getReason(), request.getRequestURI());
            auditInterceptor.recordRejected(request, e);
            errorResponseWriter.write(request, response, e);
            return;
        }

        chain.doFilter(request, response);
    }
}
