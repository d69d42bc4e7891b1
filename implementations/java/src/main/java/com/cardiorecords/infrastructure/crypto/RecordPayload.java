package com.cardiorecords.infrastructure.crypto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Clinical content that only ever exists inside the encrypted envelope: the
 * uploaded file name, the lead labels and the raw artifact bytes.
 */
@Value
@Builder
@Jacksonized
public class RecordPayload {
    String fileName;
    String contentType;
    @Singular
    List<String> leadLabels;
    byte[] data;

    @Override
    public String toString() {
        return "RecordPayload[contentType=" + contentType + ", size=" + (data == null ? 0 : data.length) + "]";
    }
}
