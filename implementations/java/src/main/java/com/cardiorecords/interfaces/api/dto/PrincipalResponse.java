package com.cardiorecords.interfaces.api.dto;

import com.cardiorecords.domain.model.Principal;
import com.cardiorecords.domain.model.Role;
import com.cardiorecords.infrastructure.audit.AuditableResponse;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Public view of a principal. Never carries the password hash, the failed
 * attempt counter or the lock.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrincipalResponse implements AuditableResponse {

    private UUID id;
    private String email;
    private String name;
    private Role role;
    private boolean active;
    private Instant lastLoginAt;
    private Instant createdAt;

    public static PrincipalResponse from(Principal principal) {
        return PrincipalResponse.builder()
            .id(principal.getId())
            .email(principal.getEmail())
            .name(principal.getDisplayName())
            .role(principal.getRole())
            .active(principal.isActive())
            .lastLoginAt(principal.getLastLoginAt())
            .createdAt(principal.getCreatedAt())
            .build();
    }

    @Override
    @JsonIgnore
    public String auditResourceId() {
        return id == null ? null : id.toString();
    }
}
