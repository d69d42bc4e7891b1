package com.cardiorecords.infrastructure.persistence;

import com.cardiorecords.domain.model.AuditMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores {@link AuditMetadata} as a flat JSON object.
 */
@Converter(autoApply = true)
public class AuditMetadataConverter implements AttributeConverter<AuditMetadata, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(AuditMetadata attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute.asMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit metadata is not serializable", e);
        }
    }

    @Override
    public AuditMetadata convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return AuditMetadata.empty();
        }
        try {
            Map<String, Object> raw = MAPPER.readValue(dbData, MAP_TYPE);
            return AuditMetadata.of(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored audit metadata is not valid JSON", e);
        }
    }
}
