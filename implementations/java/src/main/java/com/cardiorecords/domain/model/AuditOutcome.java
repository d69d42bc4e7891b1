package com.cardiorecords.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Final status of an audited operation.
 */
@Embeddable
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditOutcome {

    @Column(name = "status_code", nullable = false)
    private int statusCode;

    @Column(name = "success", nullable = false)
    private boolean success;

    public static AuditOutcome ofStatus(int statusCode) {
        return new AuditOutcome(statusCode, statusCode >= 200 && statusCode < 300);
    }
}
