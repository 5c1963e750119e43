package com.mapsheet.collection.cache;

/**
 * Snapshot of a similarity cache's counters. Name comparisons repeat for every file event,
 * so a healthy monitor shows a hit rate close to 1 after the first few files.
 *
 * @param hitCount      name pairs answered from the cache
 * @param missCount     name pairs that had to be scored
 * @param evictionCount scores dropped to respect the size bound
 * @param size          scored name pairs currently held
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    /**
     * Share of lookups answered from the cache, 0 before any lookup.
     */
    public double hitRate() {
        long lookups = lookupCount();
        return lookups == 0 ? 0.0 : (double) hitCount / lookups;
    }

    public long lookupCount() {
        return hitCount + missCount;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
