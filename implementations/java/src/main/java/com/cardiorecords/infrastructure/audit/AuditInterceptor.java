package com.cardiorecords.infrastructure.audit;

import com.cardiorecords.application.SecurityContextProvider;
import com.cardiorecords.application.exceptions.ApiErrorCatalog;
import com.cardiorecords.application.exceptions.AuthorizationException;
import com.cardiorecords.domain.model.AuditAction;
import com.cardiorecords.domain.model.AuditEntry;
import com.cardiorecords.domain.model.AuditMetadata;
import com.cardiorecords.domain.model.AuditOutcome;
import com.cardiorecords.domain.model.RequestMetadata;
import com.cardiorecords.domain.model.ResourceKind;
import com.cardiorecords.domain.model.Role;
import com.cardiorecords.infrastructure.security.AuthorizationDecision;
import com.cardiorecords.infrastructure.security.Authorizer;
import com.cardiorecords.infrastructure.security.SecurityContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wraps protected operations and writes exactly one audit entry per invocation.
 *
 * Flow:
 * 1. Role check through the {@link Authorizer}; a deny becomes an
 *    {@code ACCESS_DENIED} entry and an {@link AuthorizationException}
 * 2. The operation runs
 * 3. In {@code finally}, one entry is written with the status the client will
 *    receive: the response status on success, the mapped status on failure
 *
 * A failed audit write goes to the {@link AuditAlertChannel} and is never
 * rethrown. Entries never carry payload content, only response time and
 * error type as metadata.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditInterceptor {

    private static final Pattern UUID_IN_PATH = Pattern.compile(
        "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private final AuditTrail auditTrail;
    private final AuditAlertChannel alertChannel;
    private final Authorizer authorizer;
    private final SecurityContextProvider contextProvider;
    private final Clock clock;

    @FunctionalInterface
    public interface AuditedOperation {
        Object proceed() throws Throwable;
    }

    public Object intercept(AuditedCall call, AuditedOperation operation) throws Throwable {
        long started = System.nanoTime();
        SecurityContext context = contextProvider.findCurrentContext().orElse(null);
        Role role = context == null ? null : context.getRole();

        AuditAction action = call.getExplicitAction();
        int status = call.getSuccessStatus();
        Throwable failure = null;
        Object result = null;
        try {
            if (!call.getRequiredRoles().isEmpty()) {
                AuthorizationDecision decision = authorizer.authorize(role, call.getRequiredRoles());
                if (!decision.isAllowed()) {
                    action = AuditAction.ACCESS_DENIED;
                    throw denial(context, call);
                }
            }
            result = operation.proceed();
            status = statusOf(result, status);
            return result;
        } catch (Throwable t) {
            failure = t;
            status = ApiErrorCatalog.resolve(t).getStatus();
            throw t;
        } finally {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            RequestMetadata request = call.getRequest() == null ? RequestMetadata.none() : call.getRequest();
            AuditAction resolved = AuditActionClassifier.classify(action, request.getMethod(), request.getPath(),
                status);

            AuditableResponse auditable = auditableBody(result);
            String resourceId = call.getResourceId();
            if (resourceId == null && auditable != null) {
                resourceId = auditable.auditResourceId();
            }
            UUID actorId = context != null ? context.getPrincipalId()
                : auditable != null ? auditable.auditActorId() : null;
            Role actorRole = role != null ? role : auditable != null ? auditable.auditActorRole() : null;

            AuditMetadata metadata = AuditMetadata.empty().with("responseTimeMs", elapsedMs);
            if (failure != null) {
                metadata = metadata.with("errorType", ApiErrorCatalog.errorType(failure));
            }

            write(AuditEntry.builder()
                .id(UUID.randomUUID())
                .actorId(actorId)
                .actorRole(actorRole)
                .action(resolved)
                .resourceKind(call.getResourceKind())
                .resourceId(resourceId)
                .request(request)
                .outcome(AuditOutcome.ofStatus(status))
                .metadata(metadata)
                .occurredAt(clock.instant())
                .build());
        }
    }

    /**
     * Role check for a request whose arguments are not yet bound. A denial is
     * written as an {@code ACCESS_DENIED} entry before the exception leaves, so
     * callers without the role never reach body validation.
     *
     * @throws AuthorizationException when the current role is not allowed
     */
    public void enforceRoles(AuditedCall call) {
        if (call.getRequiredRoles().isEmpty()) {
            return;
        }
        SecurityContext context = contextProvider.findCurrentContext().orElse(null);
        Role role = context == null ? null : context.getRole();
        if (authorizer.authorize(role, call.getRequiredRoles()).isAllowed()) {
            return;
        }
        AuthorizationException denied = denial(context, call);
        RequestMetadata request = call.getRequest() == null ? RequestMetadata.none() : call.getRequest();
        write(AuditEntry.builder()
            .id(UUID.randomUUID())
            .actorId(context == null ? null : context.getPrincipalId())
            .actorRole(role)
            .action(AuditAction.ACCESS_DENIED)
            .resourceKind(call.getResourceKind())
            .resourceId(call.getResourceId())
            .request(request)
            .outcome(AuditOutcome.ofStatus(ApiErrorCatalog.resolve(denied).getStatus()))
            .metadata(AuditMetadata.empty().with("errorType", ApiErrorCatalog.errorType(denied)))
            .occurredAt(clock.instant())
            .build());
        throw denied;
    }

    private static AuthorizationException denial(SecurityContext context, AuditedCall call) {
        Role role = context == null ? null : context.getRole();
        log.warn("AUTHORIZATION DENIED: principal={}, role={}, resource={}/{}, required={}",
            context == null ? null : context.getPrincipalId(), role,
            call.getResourceKind(), call.getResourceId(), call.getRequiredRoles());
        return new AuthorizationException(role, call.getRequiredRoles(), call.getResourceKind(), call.getResourceId());
    }

    /**
     * Records a request rejected before any protected operation ran: missing,
     * invalid or expired token, or a locked or deactivated principal.
     */
    public void recordRejected(HttpServletRequest request, Throwable cause) {
        int status = ApiErrorCatalog.resolve(cause).getStatus();
        String path = request.getRequestURI();
        write(AuditEntry.builder()
            .id(UUID.randomUUID())
            .action(AuditAction.ACCESS_DENIED)
            .resourceKind(resourceKindOf(path))
            .resourceId(resourceIdOf(path))
            .request(requestMetadata(request))
            .outcome(AuditOutcome.ofStatus(status))
            .metadata(AuditMetadata.empty().with("errorType", ApiErrorCatalog.errorType(cause)))
            .occurredAt(clock.instant())
            .build());
    }

    public static RequestMetadata requestMetadata(HttpServletRequest request) {
        return RequestMetadata.of(request.getMethod(), request.getRequestURI(), request.getRemoteAddr(),
            request.getHeader("User-Agent"));
    }

    private void write(AuditEntry entry) {
        try {
            auditTrail.record(entry);
        } catch (RuntimeException e) {
            alertChannel.auditWriteFailed(entry, e);
        }
    }

    private static int statusOf(Object result, int fallback) {
        if (result instanceof ResponseEntity) {
            return ((ResponseEntity<?>) result).getStatusCode().value();
        }
        return fallback;
    }

    private static AuditableResponse auditableBody(Object result) {
        Object body = result instanceof ResponseEntity ? ((ResponseEntity<?>) result).getBody() : result;
        return body instanceof AuditableResponse ? (AuditableResponse) body : null;
    }

    static ResourceKind resourceKindOf(String path) {
        if (path == null) {
            return ResourceKind.SYSTEM;
        }
        if (path.startsWith("/api/records")) {
            return ResourceKind.ECG_RECORD;
        }
        if (path.startsWith("/api/auth") || path.startsWith("/api/admin")) {
            return ResourceKind.USER;
        }
        return ResourceKind.SYSTEM;
    }

    static String resourceIdOf(String path) {
        if (path == null) {
            return null;
        }
        Matcher matcher = UUID_IN_PATH.matcher(path);
        return matcher.find() ? matcher.group() : null;
    }
}
