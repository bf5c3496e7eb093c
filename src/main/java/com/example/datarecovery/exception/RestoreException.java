package com.example.datarecovery.exception;

/**
 * The pre-restore safety snapshot or the write-back transaction failed.
 * In both cases the live store is unchanged: the safety snapshot precedes
 * any mutation and the write-back transaction rolls back as a unit.
 */
public class RestoreException extends RecoveryException {

    public RestoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
