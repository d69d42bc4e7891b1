package com.cardiorecords.interfaces.api.dto;

import com.cardiorecords.application.exceptions.ApiErrorCatalog;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Standard error response DTO.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private UUID requestId;
    private Instant timestamp;
    private Integer status;
    private String code;
    private String message;
    private String path;
    private List<ValidationError> validationErrors;

    public static ErrorResponse of(ApiErrorCatalog.ApiError error, String path, Instant timestamp) {
        return ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(timestamp)
            .status(error.getStatus())
            .code(error.getCode().name())
            .message(error.getMessage())
            .path(path)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ValidationError {
        private String field;
        private String message;
    }
}
