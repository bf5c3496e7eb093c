package com.example.datarecovery.persistence;

import com.example.datarecovery.model.RecoveryMetadata;
import com.example.datarecovery.model.RecoveryPointKind;
import com.example.datarecovery.model.RecoveryPointStatus;
import com.example.datarecovery.model.RecoveryTrigger;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persistent row of the recovery point catalog.
 */
@Entity
@Table(name = "recovery_points", indexes = {
    @Index(name = "idx_recovery_points_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryPointEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Creation time of the snapshot.
     */
    @Column(name = "created_at", nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RecoveryPointKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 16)
    private RecoveryTrigger trigger;

    /**
     * Free-form text of any length.
     */
    @Lob
    @Column(nullable = false)
    private String description;

    @Column(nullable = false)
    private long sizeBytes;

    /**
     * SHA-256 hex digest of the plaintext payload.
     */
    @Column(nullable = false, length = 64)
    private String checksum;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RecoveryPointStatus status;

    @Convert(converter = RecoveryMetadataConverter.class)
    @Column(name = "metadata_json", nullable = false, length = 16384)
    private RecoveryMetadata metadata;
}
