package com.cardiorecords.domain.model;

/**
 * Resource categories that appear in the audit trail.
 */
public enum ResourceKind {
    USER,
    ECG_RECORD,
    REPORT,
    SYSTEM
}
