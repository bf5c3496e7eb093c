package com.example.datarecovery.model;

/**
 * Who asked for a snapshot: a caller (MANUAL) or the recovery subsystem itself,
 * e.g. the safety snapshot taken before every restore (AUTOMATIC).
 */
public enum RecoveryTrigger {
    MANUAL,
    AUTOMATIC
}
