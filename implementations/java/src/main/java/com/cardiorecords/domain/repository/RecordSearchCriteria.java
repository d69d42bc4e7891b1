package com.cardiorecords.domain.repository;

import com.cardiorecords.domain.model.Classification;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Optional filters for listing records. Null fields are ignored.
 */
@Value
@Builder
public class RecordSearchCriteria {
    Classification classification;
    Instant from;
    Instant to;

    public static RecordSearchCriteria none() {
        return RecordSearchCriteria.builder().build();
    }
}
