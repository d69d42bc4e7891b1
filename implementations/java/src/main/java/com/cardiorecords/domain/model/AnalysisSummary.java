package com.cardiorecords.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Non-sensitive classification metadata kept in the clear for querying.
 *
 * <p>Produced by the upstream analyzer; this service only stores it.
 */
@Embeddable
@Getter
@Builder
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AnalysisSummary {

    @Enumerated(EnumType.STRING)
    @Column(name = "classification", nullable = false, length = 32)
    private Classification classification;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Column(name = "heart_rate")
    private Integer heartRate;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 16)
    private Severity severity;

    @Column(name = "lead_count", nullable = false)
    private int leadCount;

    @Column(name = "model_version", length = 32)
    private String modelVersion;
}
