package com.cardiorecords.application;

import com.cardiorecords.domain.model.Classification;
import com.cardiorecords.domain.repository.ClassificationStatistics;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Per-principal summary of stored analyses.
 */
@Value
public class RecordStatistics {
    long totalAnalyses;
    Instant lastAnalysisAt;
    Classification lastClassification;
    List<ClassificationStatistics> byClassification;
}
