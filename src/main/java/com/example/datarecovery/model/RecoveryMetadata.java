package com.example.datarecovery.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Describes what a snapshot contains. Always fully populated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryMetadata {

    /**
     * Store schema version the snapshot was taken under.
     */
    private String schemaVersion;

    /**
     * Collection names in enumeration order.
     */
    private List<String> collections;

    /**
     * Record count per collection name.
     */
    private Map<String, Integer> recordCounts;
}
