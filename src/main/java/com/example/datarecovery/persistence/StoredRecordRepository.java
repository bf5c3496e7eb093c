package com.example.datarecovery.persistence;

import com.example.datarecovery.store.StoreCollection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for records of the application's record store.
 */
@Repository
public interface StoredRecordRepository extends JpaRepository<StoredRecordEntity, Long> {

    /**
     * All records of a collection in insertion order.
     */
    List<StoredRecordEntity> findByCollectionOrderByIdAsc(StoreCollection collection);

    long countByCollection(StoreCollection collection);

    /**
     * Bulk delete of a whole collection. Must run inside a transaction.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM StoredRecordEntity r WHERE r.collection = ?1")
    int deleteByCollection(StoreCollection collection);
}
