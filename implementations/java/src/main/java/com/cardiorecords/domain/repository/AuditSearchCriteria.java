package com.cardiorecords.domain.repository;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Filters for the audit export. Null fields are ignored.
 */
@Value
@Builder
public class AuditSearchCriteria {
    UUID actorId;
    Instant from;
    Instant to;
}
