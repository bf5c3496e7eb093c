package com.example.datarecovery.persistence;

import com.example.datarecovery.store.StoreCollection;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One record of the application's record store.
 * Insertion order within a collection is the id order.
 */
@Entity
@Table(name = "store_records", indexes = {
    @Index(name = "idx_store_records_collection", columnList = "collection_name,id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StoredRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Collection this record belongs to.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "collection_name", nullable = false, length = 32)
    private StoreCollection collection;

    /**
     * The record itself, as a JSON document.
     */
    @Lob
    @Column(name = "document_json", nullable = false)
    private String document;
}
