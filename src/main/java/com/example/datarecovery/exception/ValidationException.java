package com.example.datarecovery.exception;

import com.example.datarecovery.store.StoreCollection;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One or more snapshot records failed schema validation during a validated restore.
 * Raised before the pre-restore snapshot and before any mutation.
 */
@Getter
public class ValidationException extends RecoveryException {

    private final Map<StoreCollection, List<String>> errors;

    public ValidationException(Map<StoreCollection, List<String>> errors) {
        super("Data validation failed for collections: " + errors.keySet().stream()
                .map(StoreCollection::collectionName)
                .collect(Collectors.joining(", ")));
        this.errors = Collections.unmodifiableMap(new EnumMap<>(errors));
    }
}
