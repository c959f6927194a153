package com.example.lrucache.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-capacity, thread-safe key-value cache with least-recently-used eviction.
 *
 * <p>Entries live in a {@link RecencyList} slot arena; an index maps each key to its slot so
 * lookup, promotion and removal are O(1). Both structures are guarded by one lock and are never
 * touched separately. {@link #get(Object)} reorders entries, so it takes the same exclusive lock
 * as {@link #put(Object, Object)} and {@link #remove(Object)}.
 *
 * <p>The only caller code run under the lock is the key's {@code equals}/{@code hashCode}, which
 * must be side-effect free. Keys and values must not be {@code null}.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class LruCache<K, V> {

    private static final Logger log = LoggerFactory.getLogger(LruCache.class);

    private final ReentrantLock lock = new ReentrantLock();

    private final int capacity;
    private final Map<K, Integer> index;
    private final RecencyList<K, V> order;

    // written only while holding the lock
    private volatile int size;

    private long hits;
    private long misses;
    private long evictions;

    /**
     * @param capacity maximum number of resident entries, must be positive
     * @throws IllegalArgumentException if {@code capacity <= 0}
     */
    public LruCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.index = new HashMap<>(Math.max(16, (int) (capacity / 0.75f) + 1));
        this.order = new RecencyList<>(capacity);
        log.debug("Created LRU cache with capacity {}", capacity);
    }

    /**
     * Returns the value for {@code key} and marks it most recently used.
     *
     * @return the value, or empty if the key is not resident
     */
    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            Integer slot = index.get(key);
            if (slot == null) {
                misses++;
                return Optional.empty();
            }
            hits++;
            order.moveToFront(slot);
            return Optional.of(order.value(slot));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts or replaces the value for {@code key} and marks it most recently used. Inserting a
     * new key into a full cache evicts the least recently used entry; replacing never evicts.
     */
    public void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        K evicted = null;
        lock.lock();
        try {
            Integer slot = index.get(key);
            if (slot != null) {
                order.setValue(slot, value);
                order.moveToFront(slot);
                return;
            }

            if (!order.hasFreeSlot()) {
                evicted = evictTail();
            }

            int newSlot = order.addFirst(key, value);
            try {
                index.put(key, newSlot);
            } catch (Error e) {
                // index could not grow: take the entry back out so both sides still agree
                order.release(newSlot);
                size = order.linkedCount();
                throw e;
            }
            size = order.linkedCount();
        } finally {
            lock.unlock();
        }

        if (evicted != null && log.isTraceEnabled()) {
            log.trace("Evicted least recently used key {}", evicted);
        }
    }

    /**
     * Removes {@code key} if resident.
     *
     * @return {@code true} if an entry was removed, {@code false} if the key was absent
     */
    public boolean remove(K key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            Integer slot = index.remove(key);
            if (slot == null) {
                return false;
            }
            order.release(slot);
            size = order.linkedCount();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of resident entries. Reads a counter published at the end of each critical section,
     * so no lock is taken.
     */
    public int size() {
        return size;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Presence check that does not change recency order or hit/miss counters.
     */
    public boolean containsKey(K key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            return index.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every entry. Counters are kept.
     */
    public void clear() {
        lock.lock();
        try {
            index.clear();
            order.clear();
            size = 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return resident keys ordered from most to least recently used
     */
    public List<K> keys() {
        lock.lock();
        try {
            List<K> result = new ArrayList<>(order.linkedCount());
            for (int slot = order.head(); slot != RecencyList.NIL; slot = order.next(slot)) {
                result.add(order.key(slot));
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hits, misses, evictions, order.linkedCount(), capacity);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Walks the recency sequence, the free list and the index and checks that they agree.
     *
     * @throws IllegalStateException on the first inconsistency found
     */
    void verifyIntegrity() {
        lock.lock();
        try {
            int count = 0;
            int expectedPrev = RecencyList.NIL;
            int last = RecencyList.NIL;
            for (int slot = order.head(); slot != RecencyList.NIL; slot = order.next(slot)) {
                if (++count > capacity) {
                    throw new IllegalStateException("Recency sequence longer than capacity " + capacity);
                }
                if (order.prev(slot) != expectedPrev) {
                    throw new IllegalStateException("Broken back link at slot " + slot);
                }
                K key = order.key(slot);
                if (key == null) {
                    throw new IllegalStateException("Linked slot " + slot + " holds no key");
                }
                Integer indexed = index.get(key);
                if (indexed == null || indexed != slot) {
                    throw new IllegalStateException("Index does not point at slot " + slot);
                }
                expectedPrev = slot;
                last = slot;
            }
            if (last != order.tail()) {
                throw new IllegalStateException("Tail is " + order.tail() + " but sequence ends at " + last);
            }
            if (count != index.size() || count != order.linkedCount() || count != size) {
                throw new IllegalStateException(String.format(
                    "Count mismatch: sequence=%d index=%d linked=%d size=%d",
                    count, index.size(), order.linkedCount(), size));
            }

            int free = 0;
            for (int slot = order.freeHead(); slot != RecencyList.NIL; slot = order.next(slot)) {
                if (++free > capacity || order.key(slot) != null) {
                    throw new IllegalStateException("Corrupt free list at slot " + slot);
                }
            }
            if (count + free != capacity) {
                throw new IllegalStateException(String.format(
                    "Slots lost: linked=%d free=%d capacity=%d", count, free, capacity));
            }
        } finally {
            lock.unlock();
        }
    }

    // Must be called with the lock held.
    private K evictTail() {
        int tail = order.tail();
        K key = order.key(tail);
        index.remove(key);
        order.release(tail);
        evictions++;
        return key;
    }
}
