package com.example.datarecovery.validation;

import lombok.Value;

import java.util.List;

@Value
public class SchemaValidationResult {

    boolean success;
    List<String> errors;

    public static SchemaValidationResult success() {
        return new SchemaValidationResult(true, List.of());
    }

    public static SchemaValidationResult failure(List<String> errors) {
        return new SchemaValidationResult(false, List.copyOf(errors));
    }
}
