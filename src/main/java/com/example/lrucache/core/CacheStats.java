package com.example.lrucache.core;

/**
 * Point-in-time counters of an {@link LruCache}.
 */
public final class CacheStats {

    private final long hits;
    private final long misses;
    private final long evictions;
    private final int size;
    private final int capacity;

    public CacheStats(long hits, long misses, long evictions, int size, int capacity) {
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
        this.size = size;
        this.capacity = capacity;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getEvictions() {
        return evictions;
    }

    public int getSize() {
        return size;
    }

    public int getCapacity() {
        return capacity;
    }

    // 0.0 until the first lookup
    public double getHitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    @Override
    public String toString() {
        return String.format("CacheStats{size=%d/%d, hits=%d, misses=%d, evictions=%d, hitRate=%.2f}",
            size, capacity, hits, misses, evictions, getHitRate());
    }
}
