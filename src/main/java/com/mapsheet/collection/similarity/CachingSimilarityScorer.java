package com.mapsheet.collection.similarity;

import com.mapsheet.collection.cache.SimilarityCache;
import com.mapsheet.collection.metrics.MetricsService;
import com.mapsheet.collection.metrics.NoOpMetricsService;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Memoizes another {@link SimilarityAlgorithm} per (s1, s2) pair.
 * The same candidate and file-name fragments recur for every event of a period.
 */
public class CachingSimilarityScorer implements SimilarityAlgorithm {

    private final SimilarityAlgorithm delegate;
    private final SimilarityCache cache;
    private final MetricsService metricsService;

    public CachingSimilarityScorer(SimilarityAlgorithm delegate, SimilarityCache cache) {
        this(delegate, cache, NoOpMetricsService.INSTANCE);
    }

    public CachingSimilarityScorer(SimilarityAlgorithm delegate, SimilarityCache cache,
                                   MetricsService metricsService) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        OptionalDouble cached = cache.get(s1, s2);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.getAsDouble();
        }
        metricsService.recordCacheMiss();
        double score = delegate.compute(s1, s2);
        metricsService.recordSimilarityScore(score);
        cache.put(s1, s2, score);
        return score;
    }

    @Override
    public String getName() {
        return "Caching(" + delegate.getName() + ")";
    }

    public SimilarityCache getCache() {
        return cache;
    }
}
