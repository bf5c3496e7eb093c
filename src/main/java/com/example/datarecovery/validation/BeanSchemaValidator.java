package com.example.datarecovery.validation;

import com.example.datarecovery.store.StoreCollection;
import com.example.datarecovery.validation.schema.CandidateRecord;
import com.example.datarecovery.validation.schema.ClientRecord;
import com.example.datarecovery.validation.schema.InvoiceRecord;
import com.example.datarecovery.validation.schema.JobRecord;
import com.example.datarecovery.validation.schema.UserRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates records by binding them to a Bean Validation annotated type per collection.
 * Collections without a registered schema (employees, auditLogs) always pass.
 */
@Component
@Slf4j
public class BeanSchemaValidator implements SchemaValidator {

    private static final Map<StoreCollection, Class<?>> SCHEMAS = new EnumMap<>(StoreCollection.class);

    static {
        SCHEMAS.put(StoreCollection.USERS, UserRecord.class);
        SCHEMAS.put(StoreCollection.CANDIDATES, CandidateRecord.class);
        SCHEMAS.put(StoreCollection.JOBS, JobRecord.class);
        SCHEMAS.put(StoreCollection.CLIENTS, ClientRecord.class);
        SCHEMAS.put(StoreCollection.INVOICES, InvoiceRecord.class);
    }

    private final Validator validator;
    private final ObjectMapper objectMapper;

    public BeanSchemaValidator(Validator validator, ObjectMapper objectMapper) {
        this.validator = validator;
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public SchemaValidationResult validate(StoreCollection collection, JsonNode record) {
        Class<?> schema = SCHEMAS.get(collection);
        if (schema == null) {
            return SchemaValidationResult.success();
        }
        if (record == null || !record.isObject()) {
            return SchemaValidationResult.failure(List.of("record must be a JSON object"));
        }

        Object bound;
        try {
            bound = objectMapper.treeToValue(record, schema);
        } catch (MismatchedInputException e) {
            String field = e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining("."));
            return SchemaValidationResult.failure(List.of(field + ": invalid value"));
        } catch (JsonProcessingException e) {
            log.debug("Record of {} could not be bound to {}", collection.collectionName(), schema.getSimpleName(), e);
            return SchemaValidationResult.failure(List.of("record could not be read: " + e.getOriginalMessage()));
        }

        Set<ConstraintViolation<Object>> violations = validator.validate(bound);
        if (violations.isEmpty()) {
            return SchemaValidationResult.success();
        }
        return SchemaValidationResult.failure(violations.stream()
            .map(v -> v.getPropertyPath() + ": " + v.getMessage())
            .sorted()
            .toList());
    }
}
