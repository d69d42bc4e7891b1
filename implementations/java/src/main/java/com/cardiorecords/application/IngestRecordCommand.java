package com.cardiorecords.application;

import com.cardiorecords.domain.model.AnalysisSummary;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Upload of one clinical artifact with the classifier's clear metadata.
 */
@Value
@Builder
public class IngestRecordCommand {
    String fileName;
    String contentType;
    byte[] data;
    @Singular
    List<String> leadLabels;
    AnalysisSummary analysis;

    @Override
    public String toString() {
        return "IngestRecordCommand[contentType=" + contentType + ", size=" + (data == null ? 0 : data.length) + "]";
    }
}
