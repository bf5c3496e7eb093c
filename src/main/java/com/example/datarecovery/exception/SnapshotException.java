package com.example.datarecovery.exception;

import lombok.Getter;

/**
 * Snapshot creation failed. When the recovery point had already been persisted
 * its id is carried here and the point is left in the catalog as FAILED;
 * otherwise the id is null and nothing was written.
 */
@Getter
public class SnapshotException extends RecoveryException {

    private final Long recoveryPointId;

    public SnapshotException(String message, Long recoveryPointId, Throwable cause) {
        super(message, cause);
        this.recoveryPointId = recoveryPointId;
    }
}
