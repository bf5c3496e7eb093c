package com.example.datarecovery.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Metadata record describing one snapshot of the record store.
 * Only {@link #status} ever changes after creation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryPoint {

    private Long id;

    private Instant timestamp;

    private RecoveryPointKind kind;

    private RecoveryTrigger trigger;

    private String description;

    /**
     * Length of the canonical serialization before encryption.
     */
    private long sizeBytes;

    /**
     * SHA-256 hex digest of the canonical serialization before encryption.
     */
    private String checksum;

    private RecoveryPointStatus status;

    private RecoveryMetadata metadata;

    public boolean isRestorable() {
        return status == RecoveryPointStatus.COMPLETED;
    }
}
