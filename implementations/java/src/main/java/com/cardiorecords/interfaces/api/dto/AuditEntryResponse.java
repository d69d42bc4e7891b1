package com.cardiorecords.interfaces.api.dto;

import com.cardiorecords.domain.model.AuditAction;
import com.cardiorecords.domain.model.AuditEntry;
import com.cardiorecords.domain.model.ResourceKind;
import com.cardiorecords.domain.model.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only export view of an audit entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntryResponse {

    private UUID id;
    private UUID actorId;
    private Role actorRole;
    private AuditAction action;
    private ResourceKind resourceKind;
    private String resourceId;
    private String method;
    private String path;
    private String origin;
    private String clientAgent;
    private Integer statusCode;
    private Boolean success;
    private Map<String, Object> metadata;
    private Instant occurredAt;

    public static AuditEntryResponse from(AuditEntry entry) {
        AuditEntryResponseBuilder builder = AuditEntryResponse.builder()
            .id(entry.getId())
            .actorId(entry.getActorId())
            .actorRole(entry.getActorRole())
            .action(entry.getAction())
            .resourceKind(entry.getResourceKind())
            .resourceId(entry.getResourceId())
            .metadata(entry.getMetadata() == null ? Map.of() : entry.getMetadata().asMap())
            .occurredAt(entry.getOccurredAt());
        if (entry.getRequest() != null) {
            builder.method(entry.getRequest().getMethod())
                .path(entry.getRequest().getPath())
                .origin(entry.getRequest().getOrigin())
                .clientAgent(entry.getRequest().getClientAgent());
        }
        if (entry.getOutcome() != null) {
            builder.statusCode(entry.getOutcome().getStatusCode())
                .success(entry.getOutcome().isSuccess());
        }
        return builder.build();
    }
}
