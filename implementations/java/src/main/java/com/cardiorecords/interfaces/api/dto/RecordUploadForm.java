package com.cardiorecords.interfaces.api.dto;

import com.cardiorecords.domain.model.Classification;
import com.cardiorecords.domain.model.Severity;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Multipart upload: the artifact file plus the classifier's clear metadata.
 */
@Data
@NoArgsConstructor
public class RecordUploadForm {

    @NotNull(message = "No file uploaded")
    private MultipartFile file;

    @NotNull(message = "Classification is required")
    private Classification classification;

    @NotNull(message = "Confidence is required")
    @DecimalMin(value = "0.0", message = "Confidence must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Confidence must be between 0 and 1")
    private Double confidence;

    @Min(value = 1, message = "Heart rate must be between 1 and 400")
    @Max(value = 400, message = "Heart rate must be between 1 and 400")
    private Integer heartRate;

    @NotNull(message = "Severity is required")
    private Severity severity;

    @Min(value = 1, message = "Lead count must be between 1 and 15")
    @Max(value = 15, message = "Lead count must be between 1 and 15")
    private int leadCount = 1;

    @Size(max = 32, message = "Model version must not exceed 32 characters")
    private String modelVersion;

    @Size(max = 15, message = "At most 15 lead labels")
    private List<String> leadLabels = new ArrayList<>();
}
