package com.example.datarecovery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "recovery")
@Data
public class RecoveryConfig {

    /**
     * Base64-encoded AES key (16, 24 or 32 bytes) protecting snapshot payloads.
     */
    private String encryptionKey;

    /**
     * Store schema version recorded in every recovery point.
     */
    private String schemaVersion = "1.0";

    /**
     * How long a store write waits for exclusive access to its collections.
     */
    private Duration lockTimeout = Duration.ofSeconds(30);

    private boolean auditEnabled = true;
}
