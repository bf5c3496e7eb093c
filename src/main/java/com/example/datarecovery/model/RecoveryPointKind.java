package com.example.datarecovery.model;

/**
 * Snapshot kind. Only FULL snapshots are produced; INCREMENTAL is reserved.
 */
public enum RecoveryPointKind {
    FULL,
    INCREMENTAL
}
