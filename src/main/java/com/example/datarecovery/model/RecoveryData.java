package com.example.datarecovery.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Encrypted contents of one snapshot, linked one-to-one to its recovery point.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryData {

    private Long recoveryPointId;

    /**
     * IV followed by AES-GCM ciphertext and tag.
     */
    private byte[] payload;

    private Instant timestamp;
}
