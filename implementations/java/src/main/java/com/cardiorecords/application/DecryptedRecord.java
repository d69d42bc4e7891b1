package com.cardiorecords.application;

import com.cardiorecords.domain.model.ProtectedRecord;
import com.cardiorecords.infrastructure.crypto.RecordPayload;
import lombok.Value;

/**
 * A record together with its opened payload. Only ever returned directly to
 * the owner's request.
 */
@Value
public class DecryptedRecord {
    ProtectedRecord record;
    RecordPayload payload;

    @Override
    public String toString() {
        return "DecryptedRecord[" + record + "]";
    }
}
