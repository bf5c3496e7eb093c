package com.example.datarecovery.validation;

import com.example.datarecovery.store.StoreCollection;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Checks a single record against the schema of its collection.
 */
public interface SchemaValidator {

    SchemaValidationResult validate(StoreCollection collection, JsonNode record);
}
