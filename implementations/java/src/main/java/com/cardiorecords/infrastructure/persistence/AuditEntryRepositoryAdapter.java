package com.cardiorecords.infrastructure.persistence;

import com.cardiorecords.domain.model.AuditEntry;
import com.cardiorecords.domain.repository.AuditEntryRepository;
import com.cardiorecords.domain.repository.AuditSearchCriteria;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Adapter implementing the append-only {@link AuditEntryRepository}.
 */
@Component
@RequiredArgsConstructor
public class AuditEntryRepositoryAdapter implements AuditEntryRepository {

    private final SpringDataAuditEntryRepository springDataRepository;

    @Override
    @Transactional
    public AuditEntry append(AuditEntry entry) {
        return springDataRepository.save(entry);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<AuditEntry> search(AuditSearchCriteria criteria, Pageable pageable) {
        Specification<AuditEntry> spec = Specification.where(null);
        if (criteria.getActorId() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("actorId"), criteria.getActorId()));
        }
        if (criteria.getFrom() != null) {
            spec = spec.and((root, query, cb) ->
                cb.greaterThanOrEqualTo(root.get("occurredAt"), criteria.getFrom()));
        }
        if (criteria.getTo() != null) {
            spec = spec.and((root, query, cb) ->
                cb.lessThanOrEqualTo(root.get("occurredAt"), criteria.getTo()));
        }
        Pageable sorted = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(),
            Sort.by(Sort.Direction.DESC, "occurredAt"));
        return springDataRepository.findAll(spec, sorted);
    }
}
