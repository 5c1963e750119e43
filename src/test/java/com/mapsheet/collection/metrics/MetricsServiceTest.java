package com.mapsheet.collection.metrics;

import com.mapsheet.collection.core.model.FileCategory;
import com.mapsheet.collection.history.LookupStrategy;
import com.mapsheet.collection.resolve.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordFileResolved(FileCategory.FINISHED_OBSERVATIONS);
                noOp.recordFileRejected(RejectionReason.DATE_OUT_OF_RANGE);
                noOp.recordResolutionDuration(Duration.ofMillis(3));
                noOp.recordBackfill(LookupStrategy.FUZZY);
                noOp.recordHistoricalSearchDuration(LookupStrategy.NONE, Duration.ofMillis(40));
                noOp.recordSimilarityScore(0.85);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
                noOp.recordEventFailure();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count resolved files per category")
        void countsResolvedFiles() {
            metrics.recordFileResolved(FileCategory.FINISHED_OBSERVATIONS);
            metrics.recordFileResolved(FileCategory.FINISHED_OBSERVATIONS);
            metrics.recordFileResolved(FileCategory.PLANNED_ROUTES);

            Counter finished = registry.find("collection.file.resolved")
                    .tag("category", "FINISHED_OBSERVATIONS")
                    .counter();
            Counter planned = registry.find("collection.file.resolved")
                    .tag("category", "PLANNED_ROUTES")
                    .counter();

            assertNotNull(finished);
            assertEquals(2.0, finished.count());
            assertNotNull(planned);
            assertEquals(1.0, planned.count());
        }

        @Test
        @DisplayName("Should count rejections per reason")
        void countsRejections() {
            metrics.recordFileRejected(RejectionReason.NO_IDENTIFIER_MATCH);

            Counter counter = registry.find("collection.file.rejected")
                    .tag("reason", "NO_IDENTIFIER_MATCH")
                    .counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("Should count backfills and time historical lookups per strategy")
        void recordsHistory() {
            metrics.recordBackfill(LookupStrategy.EXACT);
            metrics.recordHistoricalSearchDuration(LookupStrategy.EXACT, Duration.ofMillis(20));
            metrics.recordHistoricalSearchDuration(LookupStrategy.EXACT, Duration.ofMillis(30));

            Counter backfills = registry.find("collection.backfill").tag("strategy", "EXACT").counter();
            Timer timer = registry.find("collection.history.duration").tag("strategy", "EXACT").timer();

            assertNotNull(backfills);
            assertEquals(1.0, backfills.count());
            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("Should time resolutions")
        void timesResolutions() {
            metrics.recordResolutionDuration(Duration.ofMillis(5));
            Timer timer = registry.find("collection.resolution.duration").timer();
            assertNotNull(timer);
            assertEquals(1, timer.count());
        }

        @Test
        @DisplayName("Should record similarity score distribution")
        void recordsSimilarityScores() {
            metrics.recordSimilarityScore(0.9);
            metrics.recordSimilarityScore(0.5);

            DistributionSummary summary = registry.find("collection.similarity.score").summary();
            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(1.4, summary.totalAmount(), 1e-9);
        }

        @Test
        @DisplayName("Should count cache hits, misses and event failures")
        void countsCacheAndFailures() {
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordEventFailure();

            assertEquals(2.0, registry.find("collection.cache.hit").counter().count());
            assertEquals(1.0, registry.find("collection.cache.miss").counter().count());
            assertEquals(1.0, registry.find("collection.event.failure").counter().count());
        }
    }
}
