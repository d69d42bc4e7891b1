package com.cardiorecords.application.exceptions;

import com.cardiorecords.domain.model.ResourceKind;
import com.cardiorecords.domain.model.Role;

import java.util.Set;

/**
 * The authenticated principal lacks a role the operation requires.
 */
public class AuthorizationException extends PhiException {

    private final ResourceKind resourceKind;
    private final String resourceId;

    public AuthorizationException(Role actual, Set<Role> required, ResourceKind resourceKind, String resourceId) {
        super("Role " + actual + " not in " + required + " for " + resourceKind + "/" + resourceId);
        this.resourceKind = resourceKind;
        this.resourceId = resourceId;
    }

    public ResourceKind getResourceKind() {
        return resourceKind;
    }

    public String getResourceId() {
        return resourceId;
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.FORBIDDEN;
    }
}
