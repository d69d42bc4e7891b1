package com.cardiorecords.infrastructure.audit;

import com.cardiorecords.application.SecurityContextProvider;
import com.cardiorecords.application.exceptions.AuditException;
import com.cardiorecords.application.exceptions.AuthException;
import com.cardiorecords.application.exceptions.AuthorizationException;
import com.cardiorecords.application.exceptions.ResourceNotFoundException;
import com.cardiorecords.domain.model.AuditAction;
import com.cardiorecords.domain.model.AuditEntry;
import com.cardiorecords.domain.model.RequestMetadata;
import com.cardiorecords.domain.model.ResourceKind;
import com.cardiorecords.domain.model.Role;
import com.cardiorecords.infrastructure.security.BearerAuthenticationToken;
import com.cardiorecords.infrastructure.security.RoleAuthorizer;
import com.cardiorecords.infrastructure.security.SecurityContext;
import com.cardiorecords.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.core.context.SecurityContextHolder;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AuditInterceptorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private AuditTrail auditTrail;

    private AuditAlertChannel alertChannel;
    private AuditInterceptor interceptor;
    private UUID principalId;

    @BeforeEach
    void setUp() {
        alertChannel = new AuditAlertChannel(new SimpleMeterRegistry());
        interceptor = new AuditInterceptor(auditTrail, alertChannel, new RoleAuthorizer(),
            new SecurityContextProvider(), new MutableClock(NOW));
        principalId = UUID.randomUUID();
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private void authenticateAs(Role role) {
        SecurityContextHolder.getContext().setAuthentication(new BearerAuthenticationToken(
            SecurityContext.builder()
                .principalId(principalId)
                .role(role)
                .tokenId("jti")
                .tokenIssuedAt(NOW)
                .tokenExpiresAt(NOW.plusSeconds(3600))
                .build()));
    }

    private AuditedCall.AuditedCallBuilder call(String method, String path) {
        return AuditedCall.builder()
            .resourceKind(ResourceKind.ECG_RECORD)
            .request(RequestMetadata.of(method, path, "203.0.113.7", "junit"));
    }

    private AuditEntry onlyEntry() {
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditTrail, times(1)).record(captor.capture());
        List<AuditEntry> entries = captor.getAllValues();
        assertEquals(1, entries.size());
        return entries.get(0);
    }

    @Test
    void success_writes_one_entry_with_response_status() throws Throwable {
        authenticateAs(Role.USER);

        Object result = interceptor.intercept(call("GET", "/api/records").build(),
            () -> ResponseEntity.ok("body"));

        assertTrue(result instanceof ResponseEntity);
        AuditEntry entry = onlyEntry();
        assertEquals(principalId, entry.getActorId());
        assertEquals(Role.USER, entry.getActorRole());
        assertEquals(AuditAction.READ, entry.getAction());
        assertEquals(ResourceKind.ECG_RECORD, entry.getResourceKind());
        assertEquals(200, entry.getOutcome().getStatusCode());
        assertTrue(entry.getOutcome().isSuccess());
        assertEquals(NOW, entry.getOccurredAt());
        assertTrue(entry.getMetadata().asMap().containsKey("responseTimeMs"));
        assertFalse(entry.getMetadata().asMap().containsKey("errorType"));
    }

    @Test
    void thrown_exception_writes_one_entry_with_mapped_status_and_propagates() {
        authenticateAs(Role.USER);
        UUID recordId = UUID.randomUUID();

        ResourceNotFoundException thrown = assertThrows(ResourceNotFoundException.class,
            () -> interceptor.intercept(call("GET", "/api/records/" + recordId)
                    .resourceId(recordId.toString())
                    .build(),
                () -> {
                    throw ResourceNotFoundException.record(recordId);
                }));

        assertNotNull(thrown);
        AuditEntry entry = onlyEntry();
        assertEquals(404, entry.getOutcome().getStatusCode());
        assertFalse(entry.getOutcome().isSuccess());
        assertEquals(recordId.toString(), entry.getResourceId());
        assertEquals("NOT_FOUND", entry.getMetadata().get("errorType"));
    }

    @Test
    void unexpected_exception_is_recorded_as_500_without_message() {
        authenticateAs(Role.USER);

        assertThrows(IllegalStateException.class,
            () -> interceptor.intercept(call("POST", "/api/records").build(),
                () -> {
                    throw new IllegalStateException("patient Jane Doe");
                }));

        AuditEntry entry = onlyEntry();
        assertEquals(500, entry.getOutcome().getStatusCode());
        assertEquals(AuditAction.CREATE, entry.getAction());
        assertEquals("IllegalStateException", entry.getMetadata().get("errorType"));
        assertFalse(entry.getMetadata().toString().contains("Jane"));
    }

    @Test
    void user_calling_admin_operation_is_denied_and_audited() {
        authenticateAs(Role.USER);
        AtomicBoolean ran = new AtomicBoolean(false);
        String targetId = UUID.randomUUID().toString();

        AuthorizationException ex = assertThrows(AuthorizationException.class,
            () -> interceptor.intercept(AuditedCall.builder()
                    .explicitAction(AuditAction.PERMISSION_CHANGE)
                    .resourceKind(ResourceKind.USER)
                    .resourceId(targetId)
                    .requiredRole(Role.ADMIN)
                    .request(RequestMetadata.of("PUT", "/api/admin/principals/" + targetId + "/role", null, null))
                    .build(),
                () -> {
                    ran.set(true);
                    return null;
                }));

        assertFalse(ran.get());
        assertEquals(ResourceKind.USER, ex.getResourceKind());
        AuditEntry entry = onlyEntry();
        assertEquals(AuditAction.ACCESS_DENIED, entry.getAction());
        assertEquals(403, entry.getOutcome().getStatusCode());
        assertEquals(targetId, entry.getResourceId());
        assertEquals(Role.USER, entry.getActorRole());
    }

    @Test
    void admin_passes_role_check() throws Throwable {
        authenticateAs(Role.ADMIN);

        interceptor.intercept(call("GET", "/api/audit").requiredRole(Role.ADMIN).build(),
            () -> ResponseEntity.ok().build());

        assertEquals(200, onlyEntry().getOutcome().getStatusCode());
    }

    @Test
    void audit_write_failure_is_swallowed_and_alerted() throws Throwable {
        authenticateAs(Role.USER);
        doThrow(new AuditException("database down", new RuntimeException()))
            .when(auditTrail).record(any());

        Object result = interceptor.intercept(call("GET", "/api/records").build(), () -> "ok");

        assertEquals("ok", result);
        assertEquals(1.0, alertChannel.failureCount());
    }

    @Test
    void audit_write_failure_does_not_mask_operation_failure() {
        authenticateAs(Role.USER);
        doThrow(new AuditException("database down", new RuntimeException()))
            .when(auditTrail).record(any());

        assertThrows(ResourceNotFoundException.class,
            () -> interceptor.intercept(call("GET", "/api/records").build(),
                () -> {
                    throw ResourceNotFoundException.record(UUID.randomUUID());
                }));
        assertEquals(1.0, alertChannel.failureCount());
    }

    @Test
    void anonymous_call_takes_actor_from_auditable_response() throws Throwable {
        UUID registered = UUID.randomUUID();
        AuditableResponse body = new AuditableResponse() {
            @Override
            public String auditResourceId() {
                return registered.toString();
            }

            @Override
            public UUID auditActorId() {
                return registered;
            }

            @Override
            public Role auditActorRole() {
                return Role.USER;
            }
        };

        interceptor.intercept(AuditedCall.builder()
                .resourceKind(ResourceKind.USER)
                .request(RequestMetadata.of("POST", "/api/auth/login", null, null))
                .build(),
            () -> ResponseEntity.ok(body));

        AuditEntry entry = onlyEntry();
        assertEquals(AuditAction.LOGIN, entry.getAction());
        assertEquals(registered, entry.getActorId());
        assertEquals(Role.USER, entry.getActorRole());
        assertEquals(registered.toString(), entry.getResourceId());
    }

    @Test
    void failed_login_is_classified_from_status() {
        assertThrows(AuthException.class,
            () -> interceptor.intercept(AuditedCall.builder()
                    .resourceKind(ResourceKind.USER)
                    .request(RequestMetadata.of("POST", "/api/auth/login", null, null))
                    .build(),
                () -> {
                    throw AuthException.invalidCredentials();
                }));

        AuditEntry entry = onlyEntry();
        assertEquals(AuditAction.LOGIN_FAILED, entry.getAction());
        assertEquals(401, entry.getOutcome().getStatusCode());
        assertNull(entry.getActorId());
    }

    @Test
    void rejected_request_is_recorded_as_access_denied() {
        UUID recordId = UUID.randomUUID();
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/records/" + recordId);
        request.addHeader("User-Agent", "curl/8");

        interceptor.recordRejected(request, AuthException.tokenExpired());

        AuditEntry entry = onlyEntry();
        assertEquals(AuditAction.ACCESS_DENIED, entry.getAction());
        assertEquals(ResourceKind.ECG_RECORD, entry.getResourceKind());
        assertEquals(recordId.toString(), entry.getResourceId());
        assertEquals(401, entry.getOutcome().getStatusCode());
        assertEquals("curl/8", entry.getRequest().getClientAgent());
        assertNull(entry.getActorId());
    }
}
