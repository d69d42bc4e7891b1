package com.cardiorecords.interfaces.api;

import com.cardiorecords.application.DecryptedRecord;
import com.cardiorecords.application.IngestRecordCommand;
import com.cardiorecords.application.RecordService;
import com.cardiorecords.application.SecurityContextProvider;
import com.cardiorecords.domain.model.AnalysisSummary;
import com.cardiorecords.domain.model.AuditAction;
import com.cardiorecords.domain.model.Classification;
import com.cardiorecords.domain.model.ProtectedRecord;
import com.cardiorecords.domain.model.ResourceKind;
import com.cardiorecords.domain.repository.RecordSearchCriteria;
import com.cardiorecords.infrastructure.audit.Audited;
import com.cardiorecords.infrastructure.security.SecurityContext;
import com.cardiorecords.interfaces.api.dto.DeleteAllRequest;
import com.cardiorecords.interfaces.api.dto.DeleteAllResponse;
import com.cardiorecords.interfaces.api.dto.ErrorResponse;
import com.cardiorecords.interfaces.api.dto.PageResponse;
import com.cardiorecords.interfaces.api.dto.RecordPayloadResponse;
import com.cardiorecords.interfaces.api.dto.RecordResponse;
import com.cardiorecords.interfaces.api.dto.RecordStatisticsResponse;
import com.cardiorecords.interfaces.api.dto.RecordUploadForm;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for protected clinical records.
 *
 * Security:
 * - All endpoints require authentication
 * - Records are visible to their owner only
 * - Payloads are decrypted only by the payload and download endpoints
 * - Every call is audited
 */
@RestController
@RequestMapping("/api/records")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Records", description = "Encrypted clinical record storage")
@SecurityRequirement(name = "bearerAuth")
public class RecordController {

    private final RecordService recordService;
    private final SecurityContextProvider contextProvider;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    @Audited(resource = ResourceKind.ECG_RECORD, action = AuditAction.CREATE)
    @Operation(summary = "Store an artifact", description = "Encrypts the upload and stores it with its classification")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Record stored",
            content = @Content(schema = @Schema(implementation = RecordResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid file type or metadata",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "413", description = "File too large",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<RecordResponse> upload(@Valid @ModelAttribute RecordUploadForm form) throws IOException {
        SecurityContext context = contextProvider.getCurrentContext();

        IngestRecordCommand command = IngestRecordCommand.builder()
            .fileName(form.getFile().getOriginalFilename())
            .contentType(form.getFile().getContentType())
            .data(form.getFile().getBytes())
            .leadLabels(form.getLeadLabels() == null ? List.of() : form.getLeadLabels())
            .analysis(AnalysisSummary.builder()
                .classification(form.getClassification())
                .confidence(form.getConfidence())
                .heartRate(form.getHeartRate())
                .severity(form.getSeverity())
                .leadCount(form.getLeadCount())
                .modelVersion(form.getModelVersion())
                .build())
            .build();

        ProtectedRecord record = recordService.ingest(context, command);
        return ResponseEntity.status(HttpStatus.CREATED).body(RecordResponse.from(record));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Audited(resource = ResourceKind.ECG_RECORD, action = AuditAction.READ)
    @Operation(summary = "List own records", description = "Newest first; payloads are never included")
    public ResponseEntity<PageResponse<RecordResponse>> list(
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "size", defaultValue = "20") int size,
            @RequestParam(value = "classification", required = false) Classification classification,
            @RequestParam(value = "from", required = false)
                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false)
                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        RecordSearchCriteria criteria = RecordSearchCriteria.builder()
            .classification(classification)
            .from(from)
            .to(to)
            .build();
        return ResponseEntity.ok(PageResponse.from(
            recordService.list(contextProvider.getCurrentContext(), criteria, page, size), RecordResponse::from));
    }

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    @Audited(resource = ResourceKind.ECG_RECORD, action = AuditAction.READ)
    @Operation(summary = "Statistics of own records by classification")
    public ResponseEntity<RecordStatisticsResponse> statistics() {
        return ResponseEntity.ok(RecordStatisticsResponse.from(
            recordService.statistics(contextProvider.getCurrentContext())));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Audited(resource = ResourceKind.ECG_RECORD, action = AuditAction.READ, resourceIdParam = "id")
    @Operation(summary = "Get record metadata")
    public ResponseEntity<RecordResponse> get(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(RecordResponse.from(recordService.get(contextProvider.getCurrentContext(), id)));
    }

    @GetMapping(value = "/{id}/payload", produces = MediaType.APPLICATION_JSON_VALUE)
    @Audited(resource = ResourceKind.ECG_RECORD, action = AuditAction.READ, resourceIdParam = "id")
    @Operation(summary = "Get decrypted record payload")
    public ResponseEntity<RecordPayloadResponse> payload(@PathVariable("id") UUID id) {
        DecryptedRecord decrypted = recordService.open(contextProvider.getCurrentContext(), id);
        return ResponseEntity.ok()
            .header(HttpHeaders.CACHE_CONTROL, "no-store")
            .body(RecordPayloadResponse.from(decrypted));
    }

    @GetMapping("/{id}/download")
    @Audited(resource = ResourceKind.ECG_RECORD, action = AuditAction.EXPORT, resourceIdParam = "id")
    @Operation(summary = "Download the original artifact")
    public ResponseEntity<byte[]> download(@PathVariable("id") UUID id) {
        DecryptedRecord decrypted = recordService.open(contextProvider.getCurrentContext(), id);
        String fileName = decrypted.getPayload().getFileName() != null
            ? decrypted.getPayload().getFileName()
            : "record-" + id;
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(decrypted.getRecord().getContentType()))
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename(fileName).build().toString())
            .header(HttpHeaders.CACHE_CONTROL, "no-store")
            .body(decrypted.getPayload().getData());
    }

    @DeleteMapping("/{id}")
    @Audited(resource = ResourceKind.ECG_RECORD, action = AuditAction.DELETE, resourceIdParam = "id")
    @Operation(summary = "Delete a record")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id) {
        recordService.delete(contextProvider.getCurrentContext(), id);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Audited(resource = ResourceKind.ECG_RECORD, action = AuditAction.DELETE)
    @Operation(summary = "Delete all own records",
        description = "Requires {\"confirm\": \"DELETE_ALL_MY_DATA\"}")
    public ResponseEntity<DeleteAllResponse> deleteAll(@RequestBody DeleteAllRequest request) {
        long deleted = recordService.deleteAll(contextProvider.getCurrentContext(), request.getConfirm());
        return ResponseEntity.ok(new DeleteAllResponse(deleted, "Deleted " + deleted + " records."));
    }
}
