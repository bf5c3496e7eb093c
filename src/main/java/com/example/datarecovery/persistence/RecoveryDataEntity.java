package com.example.datarecovery.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Encrypted snapshot payload. Exactly one row per recovery point.
 */
@Entity
@Table(name = "recovery_data", uniqueConstraints = {
    @UniqueConstraint(name = "uk_recovery_data_point", columnNames = "recovery_point_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryDataEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "recovery_point_id", nullable = false)
    private Long recoveryPointId;

    /**
     * IV + AES-GCM ciphertext.
     */
    @Lob
    @Column(nullable = false)
    private byte[] payload;

    @Column(name = "written_at", nullable = false)
    private Instant timestamp;
}
