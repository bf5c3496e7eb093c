package com.example.datarecovery.model;

import com.example.datarecovery.store.StoreCollection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of a committed restore.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreResult {

    private Long recoveryPointId;

    /**
     * The target collection set of the write-back transaction.
     */
    private Set<StoreCollection> restoredCollections;

    /**
     * Target collections deliberately left untouched (the audit log when preserved).
     */
    private Set<StoreCollection> preservedCollections;

    private Long preRestoreSnapshotId;

    /**
     * Live record counts of the target collections right after commit.
     */
    private Map<StoreCollection, Long> recordCounts;

    private Instant timestamp;
}
