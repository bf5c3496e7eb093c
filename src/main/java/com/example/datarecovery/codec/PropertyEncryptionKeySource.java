package com.example.datarecovery.codec;

import com.example.datarecovery.config.RecoveryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.util.Base64;

/**
 * Reads the AES key from {@code recovery.encryption-key}. Startup fails if it is missing or malformed.
 */
@Component
@Slf4j
public class PropertyEncryptionKeySource implements EncryptionKeySource {

    private static final String PROPERTY = "recovery.encryption-key";

    private final SecretKey key;

    public PropertyEncryptionKeySource(RecoveryConfig config) {
        this.key = decode(config.getEncryptionKey());
        log.info("Loaded {}-bit snapshot encryption key", key.getEncoded().length * 8);
    }

    @Override
    public SecretKey getKey() {
        return key;
    }

    static SecretKey decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalStateException(PROPERTY + " is not set");
        }

        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            // Cause not chained: its message quotes the offending key character.
            throw new IllegalStateException(PROPERTY + " is not valid Base64");
        }

        if (raw.length != 16 && raw.length != 24 && raw.length != 32) {
            throw new IllegalStateException(
                PROPERTY + " must decode to 16, 24 or 32 bytes, got " + raw.length);
        }
        return new SecretKeySpec(raw, "AES");
    }
}
