package com.example.datarecovery.exception;

/**
 * Snapshot contents failed verification after decryption (checksum or record counts differ).
 * Signals corruption or tampering. Always raised before the live store is touched.
 */
public class IntegrityException extends RecoveryException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
