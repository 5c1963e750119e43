package com.mapsheet.collection.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * Caffeine-backed similarity cache. Safe for concurrent use from parallel historical scans.
 */
public class CaffeineSimilarityCache implements SimilarityCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineSimilarityCache.class);

    private final Cache<PairKey, Double> cache;

    public CaffeineSimilarityCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        log.info("CaffeineSimilarityCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    public OptionalDouble get(String s1, String s2) {
        Double score = cache.getIfPresent(new PairKey(s1, s2));
        return score != null ? OptionalDouble.of(score) : OptionalDouble.empty();
    }

    @Override
    public void put(String s1, String s2, double score) {
        cache.put(new PairKey(s1, s2), score);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all similarity cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    /**
     * Cache key for an ordered string pair.
     */
    record PairKey(String first, String second) {}
}
