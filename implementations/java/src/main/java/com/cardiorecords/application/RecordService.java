package com.cardiorecords.application;

import com.cardiorecords.application.exceptions.RequestValidationException;
import com.cardiorecords.application.exceptions.ResourceNotFoundException;
import com.cardiorecords.domain.model.ProtectedRecord;
import com.cardiorecords.domain.repository.ProtectedRecordRepository;
import com.cardiorecords.domain.repository.RecordSearchCriteria;
import com.cardiorecords.infrastructure.crypto.PhiCodec;
import com.cardiorecords.infrastructure.crypto.RecordPayload;
import com.cardiorecords.infrastructure.crypto.SealedRecord;
import com.cardiorecords.infrastructure.security.SecurityContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Ingestion and owner-scoped access to protected clinical records.
 *
 * Security:
 * - Payloads are sealed by the {@link PhiCodec} before they reach the store
 * - Every lookup is scoped to the caller; foreign records read as not found
 * - Decrypting reads re-check the integrity hash
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordService {

    public static final Set<String> ALLOWED_CONTENT_TYPES =
        Set.of("image/png", "image/jpeg", "application/pdf", "application/dicom");
    public static final long MAX_PAYLOAD_BYTES = 50L * 1024 * 1024;
    public static final String DELETE_ALL_CONFIRMATION = "DELETE_ALL_MY_DATA";
    public static final int MAX_PAGE_SIZE = 100;

    private final ProtectedRecordRepository records;
    private final PhiCodec codec;
    private final Clock clock;

    public ProtectedRecord ingest(SecurityContext context, IngestRecordCommand command) {
        String contentType = normalizeContentType(command.getContentType());
        if (!ALLOWED_CONTENT_TYPES.contains(contentType)) {
            throw new RequestValidationException(
                "Invalid file type. Allowed types: PNG, JPEG, PDF, DICOM.");
        }
        byte[] data = command.getData();
        if (data == null || data.length == 0) {
            throw new RequestValidationException("No file uploaded.");
        }
        if (data.length > MAX_PAYLOAD_BYTES) {
            throw new RequestValidationException("File too large. Maximum size is 50MB.");
        }
        if (command.getAnalysis() == null) {
            throw new RequestValidationException("Classification metadata is required.");
        }

        SealedRecord sealed = codec.seal(RecordPayload.builder()
            .fileName(command.getFileName())
            .contentType(contentType)
            .leadLabels(command.getLeadLabels())
            .data(data)
            .build());

        ProtectedRecord record = ProtectedRecord.create(context.getPrincipalId(), contentType,
            sealed.getIntegrityHash(), sealed.getEncryptedPayload(), sealed.getPayloadSize(),
            command.getAnalysis(), clock.instant());
        return records.save(record);
    }

    /**
     * @param page one-based page number
     */
    public Page<ProtectedRecord> list(SecurityContext context, RecordSearchCriteria criteria, int page, int size) {
        if (page < 1) {
            throw new RequestValidationException("Page must be at least 1.");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new RequestValidationException("Size must be between 1 and " + MAX_PAGE_SIZE + ".");
        }
        return records.search(context.getPrincipalId(), criteria, PageRequest.of(page - 1, size));
    }

    public RecordStatistics statistics(SecurityContext context) {
        UUID owner = context.getPrincipalId();
        Optional<ProtectedRecord> latest = records.findLatest(owner);
        return new RecordStatistics(
            records.countOwned(owner),
            latest.map(ProtectedRecord::getCreatedAt).orElse(null),
            latest.map(r -> r.getAnalysis().getClassification()).orElse(null),
            records.statistics(owner));
    }

    public ProtectedRecord get(SecurityContext context, UUID recordId) {
        return records.findOwned(recordId, context.getPrincipalId())
            .orElseThrow(() -> ResourceNotFoundException.record(recordId));
    }

    /**
     * Decrypts the payload of an owned record.
     */
    public DecryptedRecord open(SecurityContext context, UUID recordId) {
        ProtectedRecord record = get(context, recordId);
        RecordPayload payload = codec.open(record.getEncryptedPayload(), record.getIntegrityHash());
        log.info("Record payload decrypted: id={}, principal={}", recordId, context.getPrincipalId());
        return new DecryptedRecord(record, payload);
    }

    public void delete(SecurityContext context, UUID recordId) {
        if (!records.deleteOwned(recordId, context.getPrincipalId())) {
            throw ResourceNotFoundException.record(recordId);
        }
    }

    /**
     * @return number of records removed
     */
    public long deleteAll(SecurityContext context, String confirmation) {
        if (!DELETE_ALL_CONFIRMATION.equals(confirmation)) {
            throw new RequestValidationException(
                "Please confirm deletion by sending { \"confirm\": \"" + DELETE_ALL_CONFIRMATION + "\" }");
        }
        return records.deleteAllOwned(context.getPrincipalId());
    }

    private static String normalizeContentType(String contentType) {
        if (contentType == null) {
            return "";
        }
        int parameters = contentType.indexOf(';');
        String base = parameters >= 0 ? contentType.substring(0, parameters) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
