package com.cardiorecords.interfaces.api.dto;

import com.cardiorecords.application.DecryptedRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Decrypted payload of one record; {@code data} is serialized as base64.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordPayloadResponse {

    private UUID id;
    private String fileName;
    private String contentType;
    private int leadCount;
    private List<String> leadLabels;
    private byte[] data;

    public static RecordPayloadResponse from(DecryptedRecord decrypted) {
        return RecordPayloadResponse.builder()
            .id(decrypted.getRecord().getId())
            .fileName(decrypted.getPayload().getFileName())
            .contentType(decrypted.getPayload().getContentType())
            .leadCount(decrypted.getRecord().getAnalysis().getLeadCount())
            .leadLabels(decrypted.getPayload().getLeadLabels())
            .data(decrypted.getPayload().getData())
            .build();
    }

    @Override
    public String toString() {
        return "RecordPayloadResponse[id=" + id + "]";
    }
}
