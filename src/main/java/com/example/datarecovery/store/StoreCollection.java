package com.example.datarecovery.store;

import java.util.Arrays;
import java.util.Optional;

/**
 * The collections of the record store that take part in snapshots.
 * Catalog tables are deliberately absent so snapshots never contain snapshots.
 */
public enum StoreCollection {
    USERS("users"),
    CANDIDATES("candidates"),
    JOBS("jobs"),
    CLIENTS("clients"),
    INVOICES("invoices"),
    EMPLOYEES("employees"),
    AUDIT_LOGS("auditLogs");

    private final String collectionName;

    StoreCollection(String collectionName) {
        this.collectionName = collectionName;
    }

    /**
     * Name used in snapshot payloads, metadata and audit details.
     */
    public String collectionName() {
        return collectionName;
    }

    public static Optional<StoreCollection> fromName(String name) {
        return Arrays.stream(values())
            .filter(c -> c.collectionName.equals(name))
            .findFirst();
    }
}
