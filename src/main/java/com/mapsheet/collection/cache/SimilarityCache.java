package com.mapsheet.collection.cache;

import java.util.OptionalDouble;

/**
 * Cache for similarity scores, keyed by the ordered string pair.
 * Scores are pure functions of their inputs, so entries never need invalidation
 * other than for memory pressure.
 */
public interface SimilarityCache {

    /**
     * Gets a cached score.
     *
     * @param s1 first string
     * @param s2 second string
     * @return the cached score, or empty if not cached
     */
    OptionalDouble get(String s1, String s2);

    /**
     * Caches a score.
     */
    void put(String s1, String s2, double score);

    /**
     * Invalidates all cache entries.
     */
    void invalidateAll();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();

    /**
     * Creates the cache implementation selected by the configuration.
     */
    static SimilarityCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineSimilarityCache(config) : new NoOpSimilarityCache();
    }
}
