package com.cardiorecords.application;

import com.cardiorecords.application.exceptions.RequestValidationException;
import com.cardiorecords.application.exceptions.ResourceNotFoundException;
import com.cardiorecords.domain.model.AnalysisSummary;
import com.cardiorecords.domain.model.Classification;
import com.cardiorecords.domain.model.ProtectedRecord;
import com.cardiorecords.domain.model.Role;
import com.cardiorecords.domain.model.Severity;
import com.cardiorecords.domain.repository.ProtectedRecordRepository;
import com.cardiorecords.infrastructure.crypto.AesGcmEnvelopeCipher;
import com.cardiorecords.infrastructure.crypto.PhiCodec;
import com.cardiorecords.infrastructure.security.SecurityContext;
import com.cardiorecords.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecordServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private ProtectedRecordRepository records;

    private RecordService recordService;
    private SecurityContext context;

    @BeforeEach
    void setUp() {
        PhiCodec codec = new PhiCodec(new AesGcmEnvelopeCipher("record-service-secret", 10_000), new ObjectMapper());
        recordService = new RecordService(records, codec, new MutableClock(NOW));
        context = SecurityContext.builder()
            .principalId(UUID.randomUUID())
            .role(Role.USER)
            .tokenId("jti")
            .tokenIssuedAt(NOW)
            .tokenExpiresAt(NOW.plusSeconds(3600))
            .build();
    }

    private IngestRecordCommand.IngestRecordCommandBuilder command() {
        return IngestRecordCommand.builder()
            .fileName("ecg.pdf")
            .contentType("application/pdf")
            .data("%PDF-1.7 waveform".getBytes(StandardCharsets.UTF_8))
            .analysis(AnalysisSummary.builder()
                .classification(Classification.STEMI)
                .confidence(0.95)
                .severity(Severity.DANGER)
                .leadCount(12)
                .build());
    }

    @Test
    void ingest_stores_sealed_payload_owned_by_caller() {
        when(records.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        ProtectedRecord stored = recordService.ingest(context, command().contentType("Application/PDF; q=1").build());

        ArgumentCaptor<ProtectedRecord> captor = ArgumentCaptor.forClass(ProtectedRecord.class);
        verify(records).save(captor.capture());
        assertSame(stored, captor.getValue());
        assertTrue(stored.isOwnedBy(context.getPrincipalId()));
        assertEquals("application/pdf", stored.getContentType());
        assertFalse(stored.getEncryptedPayload().contains("PDF"));
        assertEquals(NOW, stored.getCreatedAt());
    }

    @Test
    void ingested_record_opens_for_owner() {
        when(records.save(any())).thenAnswer(invocation -> invocation.getArgument(0));
        ProtectedRecord stored = recordService.ingest(context, command().build());
        when(records.findOwned(stored.getId(), context.getPrincipalId())).thenReturn(Optional.of(stored));

        DecryptedRecord opened = recordService.open(context, stored.getId());

        assertEquals("%PDF-1.7 waveform", new String(opened.getPayload().getData(), StandardCharsets.UTF_8));
    }

    @Test
    void disallowed_content_type_is_rejected_before_encryption() {
        assertThrows(RequestValidationException.class,
            () -> recordService.ingest(context, command().contentType("text/html").build()));
        verify(records, never()).save(any());
    }

    @Test
    void empty_upload_is_rejected() {
        assertThrows(RequestValidationException.class,
            () -> recordService.ingest(context, command().data(new byte[0]).build()));
    }

    @Test
    void missing_analysis_is_rejected() {
        assertThrows(RequestValidationException.class,
            () -> recordService.ingest(context, command().analysis(null).build()));
    }

    @Test
    void paging_bounds_are_enforced() {
        assertThrows(RequestValidationException.class, () -> recordService.list(context, null, 0, 20));
        assertThrows(RequestValidationException.class, () -> recordService.list(context, null, 1, 101));
    }

    @Test
    void deleting_missing_record_is_not_found() {
        UUID id = UUID.randomUUID();
        when(records.deleteOwned(id, context.getPrincipalId())).thenReturn(false);

        assertThrows(ResourceNotFoundException.class, () -> recordService.delete(context, id));
    }

    @Test
    void delete_all_needs_exact_confirmation() {
        assertThrows(RequestValidationException.class, () -> recordService.deleteAll(context, "delete_all_my_data"));
        verify(records, never()).deleteAllOwned(any());

        when(records.deleteAllOwned(context.getPrincipalId())).thenReturn(3L);
        assertEquals(3L, recordService.deleteAll(context, RecordService.DELETE_ALL_CONFIRMATION));
    }
}
