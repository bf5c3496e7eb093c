package com.example.datarecovery.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Set;

/**
 * Access to the application's record store, one named collection at a time.
 * <p>
 * Records are opaque JSON documents. The recovery subsystem relies on
 * {@link #withTransaction} for all-or-nothing restores: implementations without
 * native multi-collection transactions must simulate them rather than weaken
 * the guarantee.
 */
public interface CollectionStore {

    /**
     * All collections known to the store, in enumeration order.
     */
    List<StoreCollection> listCollections();

    /**
     * Every record of a collection, in insertion order.
     */
    List<JsonNode> readAll(StoreCollection collection);

    long count(StoreCollection collection);

    /**
     * Remove all records of a collection.
     */
    void clear(StoreCollection collection);

    /**
     * Append records to a collection. No de-duplication is performed.
     */
    void bulkInsert(StoreCollection collection, List<? extends JsonNode> records);

    /**
     * Run {@code work} with exclusive write access to {@code collections}.
     * <ul>
     *   <li>If {@code work} throws, every mutation made inside is rolled back and the exception propagates.</li>
     *   <li>If it completes, all mutations are committed atomically and visible to subsequent reads.</li>
     * </ul>
     * Overlapping transactions are serialized; a transaction that cannot obtain access
     * fails with {@link CollectionStoreException} before mutating anything.
     */
    void withTransaction(Set<StoreCollection> collections, Runnable work);
}
