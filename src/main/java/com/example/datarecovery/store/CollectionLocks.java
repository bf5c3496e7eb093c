package com.example.datarecovery.store;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair, reentrant write lock per collection.
 * Locks are always taken in enum order so two writers over overlapping
 * collection sets cannot deadlock.
 */
@Slf4j
public class CollectionLocks {

    private final Map<StoreCollection, ReentrantLock> locks = new EnumMap<>(StoreCollection.class);
    private final Duration timeout;

    public CollectionLocks(Duration timeout) {
        this.timeout = timeout;
        for (StoreCollection collection : StoreCollection.values()) {
            locks.put(collection, new ReentrantLock(true));
        }
    }

    /**
     * Acquire the locks of all given collections, or none of them.
     *
     * @throws CollectionStoreException if a lock is not obtained within the timeout
     */
    public Held acquire(Collection<StoreCollection> collections) {
        Deque<ReentrantLock> held = new ArrayDeque<>();
        EnumSet<StoreCollection> ordered = collections.isEmpty()
            ? EnumSet.noneOf(StoreCollection.class)
            : EnumSet.copyOf(collections);

        for (StoreCollection collection : ordered) {
            ReentrantLock lock = locks.get(collection);
            boolean acquired;
            try {
                acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                release(held);
                throw new CollectionStoreException("Interrupted while locking collection " + collection.collectionName(), e);
            }
            if (!acquired) {
                release(held);
                throw new CollectionStoreException(String.format(
                    "Timed out after %d ms waiting for write access to collection %s",
                    timeout.toMillis(), collection.collectionName()));
            }
            held.push(lock);
        }

        log.trace("Locked collections {}", ordered);
        return new Held(held);
    }

    private static void release(Deque<ReentrantLock> held) {
        while (!held.isEmpty()) {
            held.pop().unlock();
        }
    }

    /**
     * Locks held by the current thread; closing releases them in reverse order.
     */
    public static final class Held implements AutoCloseable {
        private final Deque<ReentrantLock> held;

        private Held(Deque<ReentrantLock> held) {
            this.held = held;
        }

        @Override
        public void close() {
            release(held);
        }
    }
}
