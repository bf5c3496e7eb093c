package com.example.datarecovery.exception;

/**
 * Base type for every failure raised by the recovery subsystem.
 * Unchecked, so callers catch only the kinds they can act on.
 */
public class RecoveryException extends RuntimeException {

    public RecoveryException(String message) {
        super(message);
    }

    public RecoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
