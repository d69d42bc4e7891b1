package com.cardiorecords.infrastructure.audit;

import com.cardiorecords.domain.model.AuditAction;
import com.cardiorecords.domain.model.RequestMetadata;
import com.cardiorecords.domain.model.ResourceKind;
import com.cardiorecords.domain.model.Role;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Description of one protected invocation, as known before it runs.
 */
@Value
@Builder
public class AuditedCall {
    /** null when the action is derived from method and path */
    AuditAction explicitAction;
    ResourceKind resourceKind;
    String resourceId;
    @Singular
    Set<Role> requiredRoles;
    RequestMetadata request;
    @Builder.Default
    int successStatus = 200;
}
