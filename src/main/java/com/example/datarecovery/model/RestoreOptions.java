package com.example.datarecovery.model;

import com.example.datarecovery.store.StoreCollection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Options for a restore. A null or empty {@code collections} restores every collection in the snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreOptions {

    private Set<StoreCollection> collections;

    /**
     * Validate every snapshot record against its collection schema before touching the store.
     */
    private boolean validate;

    /**
     * Leave the live audit log untouched.
     */
    private boolean preserveAuditTrail;

    /**
     * Publish a {@link RecoveryRestoredEvent} once the restore has committed.
     */
    private boolean notifyUsers;

    public static RestoreOptions defaults() {
        return new RestoreOptions();
    }
}
