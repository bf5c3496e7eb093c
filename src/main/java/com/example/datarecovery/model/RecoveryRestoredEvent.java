package com.example.datarecovery.model;

import com.example.datarecovery.store.StoreCollection;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;
import java.util.Set;

/**
 * Application event published after a restore commits, when the caller asked for users to be notified.
 */
@Data
@AllArgsConstructor
public class RecoveryRestoredEvent {

    private Long recoveryPointId;

    private Long preRestoreSnapshotId;

    private Set<StoreCollection> restoredCollections;

    private Instant timestamp;
}
