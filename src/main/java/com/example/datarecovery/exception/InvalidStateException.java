package com.example.datarecovery.exception;

/**
 * The recovery point's status disallows the requested operation,
 * e.g. restoring a PENDING or FAILED point. The live store is untouched.
 */
public class InvalidStateException extends RecoveryException {

    public InvalidStateException(String message) {
        super(message);
    }
}
