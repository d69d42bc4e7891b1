package com.cardiorecords.interfaces.api.dto;

import com.cardiorecords.application.AuthenticationResult;
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
 * Principal and bearer token returned by register, login and password change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthResponse implements AuditableResponse {

    private PrincipalResponse user;
    private String token;
    private Instant expiresAt;

    public static AuthResponse from(AuthenticationResult result) {
        return AuthResponse.builder()
            .user(PrincipalResponse.from(result.getPrincipal()))
            .token(result.getToken().getValue())
            .expiresAt(result.getToken().getExpiresAt())
            .build();
    }

    @Override
    @JsonIgnore
    public String auditResourceId() {
        return user == null ? null : user.auditResourceId();
    }

    @Override
    @JsonIgnore
    public UUID auditActorId() {
        return user == null ? null : user.getId();
    }

    @Override
    @JsonIgnore
    public Role auditActorRole() {
        return user == null ? null : user.getRole();
    }

    @Override
    public String toString() {
        return "AuthResponse[user=" + (user == null ? null : user.getId()) + ", expiresAt=" + expiresAt + "]";
    }
}
