package com.mapsheet.collection.metrics;

import com.mapsheet.collection.core.model.FileCategory;
import com.mapsheet.collection.history.LookupStrategy;
import com.mapsheet.collection.resolve.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code collection.file.resolved} Counter (tag: category)</li>
 *   <li>{@code collection.file.rejected} Counter (tag: reason)</li>
 *   <li>{@code collection.resolution.duration} Timer</li>
 *   <li>{@code collection.backfill} Counter (tag: strategy)</li>
 *   <li>{@code collection.history.duration} Timer (tag: strategy)</li>
 *   <li>{@code collection.similarity.score} DistributionSummary</li>
 *   <li>{@code collection.cache.hit} / {@code collection.cache.miss} Counters</li>
 *   <li>{@code collection.event.failure} Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer resolutionTimer;
    private final DistributionSummary similarityScoreSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter eventFailureCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.resolutionTimer = Timer.builder("collection.resolution.duration")
                .description("Duration of file identity resolution")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("collection.similarity.score")
                .description("Distribution of computed similarity scores")
                .register(registry);
        this.cacheHitCounter = Counter.builder("collection.cache.hit")
                .description("Number of similarity cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("collection.cache.miss")
                .description("Number of similarity cache misses")
                .register(registry);
        this.eventFailureCounter = Counter.builder("collection.event.failure")
                .description("Number of file events that failed during handling")
                .register(registry);
    }

    @Override
    public void recordFileResolved(FileCategory category) {
        counter("resolved:" + category.name(), "collection.file.resolved",
                "Number of files resolved to a work unit", "category", category.name()).increment();
    }

    @Override
    public void recordFileRejected(RejectionReason reason) {
        counter("rejected:" + reason.name(), "collection.file.rejected",
                "Number of files rejected", "reason", reason.name()).increment();
    }

    @Override
    public void recordResolutionDuration(Duration duration) {
        resolutionTimer.record(duration);
    }

    @Override
    public void recordBackfill(LookupStrategy strategy) {
        counter("backfill:" + strategy.name(), "collection.backfill",
                "Number of deadline backfill lookups", "strategy", strategy.name()).increment();
    }

    @Override
    public void recordHistoricalSearchDuration(LookupStrategy strategy, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(strategy.name(), k ->
                Timer.builder("collection.history.duration")
                        .description("Duration of historical archive lookups")
                        .tag("strategy", strategy.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordEventFailure() {
        eventFailureCounter.increment();
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
