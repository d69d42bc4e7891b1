package com.cardiorecords.application;

import com.cardiorecords.application.exceptions.RequestValidationException;
import com.cardiorecords.domain.model.AuditEntry;
import com.cardiorecords.domain.repository.AuditEntryRepository;
import com.cardiorecords.domain.repository.AuditSearchCriteria;
import com.cardiorecords.infrastructure.security.SecurityContext;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only access to the audit trail.
 */
@Service
@RequiredArgsConstructor
public class AuditQueryService {

    public static final int MAX_PAGE_SIZE = 100;

    private final AuditEntryRepository auditEntries;

    public Page<AuditEntry> search(UUID actorId, Instant from, Instant to, int page, int size) {
        validatePaging(page, size);
        AuditSearchCriteria criteria = AuditSearchCriteria.builder()
            .actorId(actorId)
            .from(from)
            .to(to)
            .build();
        return auditEntries.search(criteria, PageRequest.of(page - 1, size));
    }

    /**
     * Activity of the calling principal.
     */
    public Page<AuditEntry> activityOf(SecurityContext context, Instant from, Instant to, int page, int size) {
        return search(context.getPrincipalId(), from, to, page, size);
    }

    private static void validatePaging(int page, int size) {
        if (page < 1) {
            throw new RequestValidationException("Page must be at least 1.");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new RequestValidationException("Size must be between 1 and " + MAX_PAGE_SIZE + ".");
        }
    }
}
