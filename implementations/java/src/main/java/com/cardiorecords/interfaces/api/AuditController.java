package com.cardiorecords.interfaces.api;

import com.cardiorecords.application.AuditQueryService;
import com.cardiorecords.application.SecurityContextProvider;
import com.cardiorecords.domain.model.AuditAction;
import com.cardiorecords.domain.model.ResourceKind;
import com.cardiorecords.domain.model.Role;
import com.cardiorecords.infrastructure.audit.Audited;
import com.cardiorecords.infrastructure.audit.RequiresRole;
import com.cardiorecords.interfaces.api.dto.AuditEntryResponse;
import com.cardiorecords.interfaces.api.dto.PageResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only audit export. Reading the audit trail is itself audited.
 */
@RestController
@RequestMapping(value = "/api/audit", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Tag(name = "Audit", description = "Audit trail export")
@SecurityRequirement(name = "bearerAuth")
public class AuditController {

    private final AuditQueryService auditQueryService;
    private final SecurityContextProvider contextProvider;

    @GetMapping
    @RequiresRole(Role.ADMIN)
    @Audited(resource = ResourceKind.SYSTEM, action = AuditAction.READ)
    @Operation(summary = "Search the audit trail", description = "ADMIN only; max page size 100")
    public ResponseEntity<PageResponse<AuditEntryResponse>> search(
            @RequestParam(value = "principalId", required = false) UUID principalId,
            @RequestParam(value = "from", required = false)
                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false)
                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "size", defaultValue = "50") int size) {
        return ResponseEntity.ok(PageResponse.from(
            auditQueryService.search(principalId, from, to, page, size), AuditEntryResponse::from));
    }

    @GetMapping("/me")
    @Audited(resource = ResourceKind.SYSTEM, action = AuditAction.READ)
    @Operation(summary = "Own activity")
    public ResponseEntity<PageResponse<AuditEntryResponse>> myActivity(
            @RequestParam(value = "from", required = false)
                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false)
                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "size", defaultValue = "50") int size) {
        return ResponseEntity.ok(PageResponse.from(
            auditQueryService.activityOf(contextProvider.getCurrentContext(), from, to, page, size),
            AuditEntryResponse::from));
    }
}
