package com.cardiorecords.interfaces.api;

import com.cardiorecords.application.PrincipalAdministrationService;
import com.cardiorecords.domain.model.AuditAction;
import com.cardiorecords.domain.model.ResourceKind;
import com.cardiorecords.domain.model.Role;
import com.cardiorecords.infrastructure.audit.Audited;
import com.cardiorecords.infrastructure.audit.RequiresRole;
import com.cardiorecords.interfaces.api.dto.ChangeRoleRequest;
import com.cardiorecords.interfaces.api.dto.PrincipalResponse;
import com.cardiorecords.interfaces.api.dto.SetActiveRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Principal administration. ADMIN only.
 */
@RestController
@RequestMapping(value = "/api/admin/principals", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Tag(name = "Administration", description = "Role, activation and lockout management")
@SecurityRequirement(name = "bearerAuth")
public class AdminController {

    private final PrincipalAdministrationService administrationService;

    @PutMapping(value = "/{id}/role", consumes = MediaType.APPLICATION_JSON_VALUE)
    @RequiresRole(Role.ADMIN)
    @Audited(resource = ResourceKind.USER, action = AuditAction.PERMISSION_CHANGE, resourceIdParam = "id")
    @Operation(summary = "Change a principal's role")
    public ResponseEntity<PrincipalResponse> changeRole(@PathVariable("id") UUID id,
                                                        @Valid @RequestBody ChangeRoleRequest request) {
        return ResponseEntity.ok(PrincipalResponse.from(administrationService.changeRole(id, request.getRole())));
    }

    @PutMapping(value = "/{id}/active", consumes = MediaType.APPLICATION_JSON_VALUE)
    @RequiresRole(Role.ADMIN)
    @Audited(resource = ResourceKind.USER, action = AuditAction.UPDATE, resourceIdParam = "id")
    @Operation(summary = "Activate or deactivate a principal")
    public ResponseEntity<PrincipalResponse> setActive(@PathVariable("id") UUID id,
                                                       @Valid @RequestBody SetActiveRequest request) {
        return ResponseEntity.ok(PrincipalResponse.from(administrationService.setActive(id, request.getActive())));
    }

    @PostMapping("/{id}/unlock")
    @RequiresRole(Role.ADMIN)
    @Audited(resource = ResourceKind.USER, action = AuditAction.UPDATE, resourceIdParam = "id")
    @Operation(summary = "Clear failed attempts and lock")
    public ResponseEntity<PrincipalResponse> unlock(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(PrincipalResponse.from(administrationService.unlock(id)));
    }
}
