package com.mapsheet.collection.cache;

import java.util.OptionalDouble;

/**
 * No-op cache implementation. All operations are no-ops.
 * Used as the default when caching is disabled.
 */
public class NoOpSimilarityCache implements SimilarityCache {

    @Override
    public OptionalDouble get(String s1, String s2) {
        return OptionalDouble.empty();
    }

    @Override
    public void put(String s1, String s2, double score) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
