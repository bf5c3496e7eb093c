package com.example.datarecovery.exception;

import lombok.Getter;

/**
 * A referenced recovery point, its recovery data, or a requested collection does not exist.
 * Raised before any mutation; the live store is untouched.
 */
@Getter
public class NotFoundException extends RecoveryException {

    private final String resource;
    private final Object id;

    public NotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }
}
