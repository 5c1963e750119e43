package com.mapsheet.collection.metrics;

import com.mapsheet.collection.core.model.FileCategory;
import com.mapsheet.collection.history.LookupStrategy;
import com.mapsheet.collection.resolve.RejectionReason;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * Used by default when no meter registry is supplied.
 */
public class NoOpMetricsService implements MetricsService {

    public static final NoOpMetricsService INSTANCE = new NoOpMetricsService();

    @Override
    public void recordFileResolved(FileCategory category) {
    }

    @Override
    public void recordFileRejected(RejectionReason reason) {
    }

    @Override
    public void recordResolutionDuration(Duration duration) {
    }

    @Override
    public void recordBackfill(LookupStrategy strategy) {
    }

    @Override
    public void recordHistoricalSearchDuration(LookupStrategy strategy, Duration duration) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordEventFailure() {
    }
}
