package com.cardiorecords.infrastructure.audit;

import com.cardiorecords.domain.model.Role;

import java.util.UUID;

/**
 * Response bodies that know which resource they describe. Lets the audit
 * entry name a resource created by the call, and the actor of a login or
 * registration that had no principal before it ran.
 */
public interface AuditableResponse {

    String auditResourceId();

    default UUID auditActorId() {
        return null;
    }

    default Role auditActorRole() {
        return null;
    }
}
