package com.cardiorecords.domain.repository;

import com.cardiorecords.domain.model.Classification;
import lombok.Value;

/**
 * Aggregate over one owner's records for a single classification.
 */
@Value
public class ClassificationStatistics {
    Classification classification;
    Long count;
    Double averageConfidence;
    Double averageHeartRate;
}
