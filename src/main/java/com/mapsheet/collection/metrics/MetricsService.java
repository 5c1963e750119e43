package com.mapsheet.collection.metrics;

import com.mapsheet.collection.core.model.FileCategory;
import com.mapsheet.collection.history.LookupStrategy;
import com.mapsheet.collection.resolve.RejectionReason;

import java.time.Duration;

/**
 * Interface for recording collection metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a meter registry.
 */
public interface MetricsService {

    void recordFileResolved(FileCategory category);

    void recordFileRejected(RejectionReason reason);

    void recordResolutionDuration(Duration duration);

    void recordBackfill(LookupStrategy strategy);

    void recordHistoricalSearchDuration(LookupStrategy strategy, Duration duration);

    void recordSimilarityScore(double score);

    void recordCacheHit();

    void recordCacheMiss();

    void recordEventFailure();
}
