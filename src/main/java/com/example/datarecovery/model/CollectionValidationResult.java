package com.example.datarecovery.model;

import com.example.datarecovery.store.StoreCollection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Schema validation outcome for all snapshot records of one collection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectionValidationResult {

    private StoreCollection collection;

    private boolean valid;

    private List<String> errors;
}
