package com.cardiorecords.infrastructure.persistence;

import com.cardiorecords.domain.model.ProtectedRecord;
import com.cardiorecords.domain.repository.ClassificationStatistics;
import com.cardiorecords.domain.repository.ProtectedRecordRepository;
import com.cardiorecords.domain.repository.RecordSearchCriteria;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter implementing the domain {@link ProtectedRecordRepository} with Spring Data JPA.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class ProtectedRecordRepositoryAdapter implements ProtectedRecordRepository {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final SpringDataProtectedRecordRepository springDataRepository;

    @Override
    public ProtectedRecord save(ProtectedRecord record) {
        ProtectedRecord saved = springDataRepository.save(record);
        log.info("Record persisted: id={}, owner={}", saved.getId(), saved.getOwnerId());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ProtectedRecord> findOwned(UUID id, UUID ownerId) {
        return springDataRepository.findByIdAndOwnerId(id, ownerId);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<ProtectedRecord> search(UUID ownerId, RecordSearchCriteria criteria, Pageable pageable) {
        Specification<ProtectedRecord> spec = ownedBy(ownerId);
        if (criteria.getClassification() != null) {
            spec = spec.and((root, query, cb) ->
                cb.equal(root.get("analysis").get("classification"), criteria.getClassification()));
        }
        if (criteria.getFrom() != null) {
            spec = spec.and((root, query, cb) ->
                cb.greaterThanOrEqualTo(root.get("createdAt"), criteria.getFrom()));
        }
        if (criteria.getTo() != null) {
            spec = spec.and((root, query, cb) ->
                cb.lessThanOrEqualTo(root.get("createdAt"), criteria.getTo()));
        }
        Pageable sorted = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), NEWEST_FIRST);
        return springDataRepository.findAll(spec, sorted);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ClassificationStatistics> statistics(UUID ownerId) {
        return springDataRepository.statisticsByOwner(ownerId);
    }

    @Override
    @Transactional(readOnly = true)
    public long countOwned(UUID ownerId) {
        return springDataRepository.countByOwnerId(ownerId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ProtectedRecord> findLatest(UUID ownerId) {
        return springDataRepository.findFirstByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    @Override
    public boolean deleteOwned(UUID id, UUID ownerId) {
        boolean deleted = springDataRepository.deleteOwned(id, ownerId) > 0;
        if (deleted) {
            log.warn("Record deleted: id={}, owner={}", id, ownerId);
        }
        return deleted;
    }

    @Override
    public long deleteAllOwned(UUID ownerId) {
        int deleted = springDataRepository.deleteAllOwned(ownerId);
        log.warn("All records deleted: owner={}, count={}", ownerId, deleted);
        return deleted;
    }

    private static Specification<ProtectedRecord> ownedBy(UUID ownerId) {
        return (root, query, cb) -> cb.equal(root.get("ownerId"), ownerId);
    }
}
