package com.example.datarecovery.exception;

/**
 * Ciphertext could not be decrypted with the current key: malformed input,
 * authentication tag mismatch or wrong key. The message never carries key material.
 */
public class DecryptionException extends IntegrityException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
