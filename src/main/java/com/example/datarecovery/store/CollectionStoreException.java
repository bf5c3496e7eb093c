package com.example.datarecovery.store;

/**
 * Store-level fault: lock acquisition timed out, a document could not be
 * (de)serialized, or the underlying database rejected an operation.
 */
public class CollectionStoreException extends RuntimeException {

    public CollectionStoreException(String message) {
        super(message);
    }

    public CollectionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
