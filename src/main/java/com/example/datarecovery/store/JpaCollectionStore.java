package com.example.datarecovery.store;

import com.example.datarecovery.persistence.StoredRecordEntity;
import com.example.datarecovery.persistence.StoredRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * {@link CollectionStore} over a single JPA table.
 * <p>
 * Atomicity comes from the database transaction opened by {@link TransactionTemplate};
 * exclusivity comes from {@link CollectionLocks}, held until after commit so the
 * next writer always starts from committed state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaCollectionStore implements CollectionStore {

    private final StoredRecordRepository recordRepository;
    private final TransactionTemplate transactionTemplate;
    private final CollectionLocks locks;
    private final ObjectMapper objectMapper;

    // Collections locked by the transaction running on this thread, if any.
    private final ThreadLocal<Set<StoreCollection>> activeTransaction = new ThreadLocal<>();

    @Override
    public List<StoreCollection> listCollections() {
        return List.of(StoreCollection.values());
    }

    @Override
    public List<JsonNode> readAll(StoreCollection collection) {
        List<StoredRecordEntity> rows = recordRepository.findByCollectionOrderByIdAsc(collection);
        List<JsonNode> records = new ArrayList<>(rows.size());
        for (StoredRecordEntity row : rows) {
            records.add(readDocument(row));
        }
        return records;
    }

    @Override
    public long count(StoreCollection collection) {
        return recordRepository.countByCollection(collection);
    }

    @Override
    public void clear(StoreCollection collection) {
        write(collection, () -> {
            int removed = recordRepository.deleteByCollection(collection);
            log.debug("Cleared {} record(s) from {}", removed, collection.collectionName());
        });
    }

    @Override
    public void bulkInsert(StoreCollection collection, List<? extends JsonNode> records) {
        List<StoredRecordEntity> rows = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            rows.add(new StoredRecordEntity(null, collection, writeDocument(record)));
        }

        write(collection, () -> {
            recordRepository.saveAll(rows);
            log.debug("Inserted {} record(s) into {}", rows.size(), collection.collectionName());
        });
    }

    @Override
    public void withTransaction(Set<StoreCollection> collections, Runnable work) {
        if (activeTransaction.get() != null) {
            throw new CollectionStoreException("Nested store transactions are not supported");
        }

        Set<StoreCollection> scope = collections.isEmpty()
            ? EnumSet.noneOf(StoreCollection.class)
            : EnumSet.copyOf(collections);

        try (CollectionLocks.Held ignored = locks.acquire(scope)) {
            activeTransaction.set(scope);
            transactionTemplate.executeWithoutResult(status -> work.run());
            log.debug("Committed store transaction over {}", scope);
        } finally {
            activeTransaction.remove();
        }
    }

    /**
     * Single-collection mutation: joins the running store transaction when there is one,
     * otherwise runs under its own lock and transaction.
     */
    private void write(StoreCollection collection, Runnable mutation) {
        Set<StoreCollection> scope = activeTransaction.get();
        if (scope != null) {
            if (!scope.contains(collection)) {
                throw new CollectionStoreException(
                    "Collection " + collection.collectionName() + " is not part of the running transaction " + scope);
            }
            mutation.run();
            return;
        }

        try (CollectionLocks.Held ignored = locks.acquire(EnumSet.of(collection))) {
            transactionTemplate.executeWithoutResult(status -> mutation.run());
        }
    }

    private JsonNode readDocument(StoredRecordEntity row) {
        try {
            return objectMapper.readTree(row.getDocument());
        } catch (JsonProcessingException e) {
            throw new CollectionStoreException(
                "Record " + row.getId() + " of " + row.getCollection().collectionName() + " is not valid JSON", e);
        }
    }

    private String writeDocument(JsonNode record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new CollectionStoreException("Record cannot be serialized", e);
        }
    }
}
