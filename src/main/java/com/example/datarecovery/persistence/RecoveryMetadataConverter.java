package com.example.datarecovery.persistence;

import com.example.datarecovery.model.RecoveryMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link RecoveryMetadata} as a JSON column.
 */
@Converter
public class RecoveryMetadataConverter implements AttributeConverter<RecoveryMetadata, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(RecoveryMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize recovery metadata", e);
        }
    }

    @Override
    public RecoveryMetadata convertToEntityAttribute(String json) {
        if (json == null) {
            return null;
        }
        try {
            return MAPPER.readValue(json, RecoveryMetadata.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to read recovery metadata", e);
        }
    }
}
