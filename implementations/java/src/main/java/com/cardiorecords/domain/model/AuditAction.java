package com.cardiorecords.domain.model;

/**
 * Kind of access recorded in an audit entry.
 */
public enum AuditAction {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    LOGIN,
    LOGIN_FAILED,
    LOGOUT,
    EXPORT,
    ANALYZE,
    VIEW_REPORT,
    ACCESS_DENIED,
    PERMISSION_CHANGE
}
