package com.example.datarecovery.codec;

import javax.crypto.SecretKey;

/**
 * Supplies the process-wide symmetric key for snapshot payloads. Read once at startup.
 */
@FunctionalInterface
public interface EncryptionKeySource {

    SecretKey getKey();
}
