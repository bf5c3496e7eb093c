package com.example.datarecovery.model;

/**
 * Lifecycle of a recovery point: PENDING until its data is stored, then COMPLETED or FAILED for good.
 */
public enum RecoveryPointStatus {
    PENDING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
