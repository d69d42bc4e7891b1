package com.cardiorecords.interfaces.api.dto;

import com.cardiorecords.domain.model.AnalysisSummary;
import com.cardiorecords.domain.model.Classification;
import com.cardiorecords.domain.model.ProtectedRecord;
import com.cardiorecords.domain.model.Severity;
import com.cardiorecords.infrastructure.audit.AuditableResponse;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Record metadata. Has no payload field; the encrypted blob never leaves the
 * service through this DTO.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordResponse implements AuditableResponse {

    private UUID id;
    private String contentType;
    private String integrityHash;
    private long payloadSize;
    private Classification classification;
    private double confidence;
    private Integer heartRate;
    private Severity severity;
    private int leadCount;
    private String modelVersion;
    private Instant createdAt;

    public static RecordResponse from(ProtectedRecord record) {
        AnalysisSummary analysis = record.getAnalysis();
        return RecordResponse.builder()
            .id(record.getId())
            .contentType(record.getContentType())
            .integrityHash(record.getIntegrityHash())
            .payloadSize(record.getPayloadSize())
            .classification(analysis.getClassification())
            .confidence(analysis.getConfidence())
            .heartRate(analysis.getHeartRate())
            .severity(analysis.getSeverity())
            .leadCount(analysis.getLeadCount())
            .modelVersion(analysis.getModelVersion())
            .createdAt(record.getCreatedAt())
            .build();
    }

    @Override
    @JsonIgnore
    public String auditResourceId() {
        return id == null ? null : id.toString();
    }
}
