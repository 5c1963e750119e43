package com.mapsheet.collection.monitor;

import com.mapsheet.collection.core.model.FileCategory;
import com.mapsheet.collection.core.model.WorkUnitIdentity;
import com.mapsheet.collection.history.HistoricalLookupResult;
import com.mapsheet.collection.history.HistoricalSearch;
import com.mapsheet.collection.logging.LogContext;
import com.mapsheet.collection.metrics.MetricsService;
import com.mapsheet.collection.metrics.NoOpMetricsService;
import com.mapsheet.collection.registry.WorkUnitRegistry;
import com.mapsheet.collection.resolve.IdentityResolver;
import com.mapsheet.collection.resolve.Rejection;
import com.mapsheet.collection.resolve.ResolutionResult;
import com.mapsheet.collection.resolve.ResolvedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one collection period.
 *
 * <p>File events from any source are put on a bounded queue; {@link #run()} is the single
 * consumer and the only writer of work unit state. Each event is resolved and applied before
 * the next one is taken. Between events the loop wakes for the status tick. The period ends
 * when every work unit is satisfied, when the deadline passes (outstanding categories are then
 * backfilled from the archive), or when {@link #stop()} is called.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * MonitorCoordinator coordinator = MonitorCoordinator.builder()
 *     .resolver(resolver)
 *     .historicalSearch(search)
 *     .eventSource(new DirectoryWatcher(dropFolder))
 *     .options(MonitorOptions.builder().deadline(LocalTime.of(22, 0)).build())
 *     .build();
 * PeriodSnapshot snapshot = coordinator.run();
 * </pre>
 */
public class MonitorCoordinator {
    private static final Logger log = LoggerFactory.getLogger(MonitorCoordinator.class);

    private final IdentityResolver resolver;
    private final HistoricalSearch historicalSearch;
    private final CollectionReporter reporter;
    private final MonitorOptions options;
    private final Clock clock;
    private final MetricsService metricsService;
    private final FileEventSource eventSource;
    private final LocalDate periodDate;
    private final Instant deadline;
    private final BlockingQueue<FileEvent> queue;
    private final Map<String, WorkUnitState> states = new LinkedHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean stopRequested;
    private volatile StatusReport latestStatus;

    private MonitorCoordinator(Builder builder) {
        this.resolver = builder.resolver;
        this.historicalSearch = builder.historicalSearch;
        this.reporter = builder.reporter;
        this.options = builder.options;
        this.clock = builder.clock;
        this.metricsService = builder.metricsService;
        this.eventSource = builder.eventSource;
        this.periodDate = resolver.getPeriod().getCollectionDate();
        this.deadline = periodDate.atTime(options.getDeadline()).atZone(clock.getZone()).toInstant();
        this.queue = new LinkedBlockingQueue<>(options.getQueueCapacity());

        WorkUnitRegistry registry = resolver.getRegistry();
        for (WorkUnitIdentity identity : registry.all()) {
            states.put(identity.identifier(), new WorkUnitState(identity, options.getRequiredCategories()));
        }
        this.latestStatus = currentStatus();
    }

    /**
     * Queues a file for handling. Safe to call from any thread.
     *
     * @return false if the queue is full and the event was dropped
     */
    public boolean submit(FileEvent event) {
        boolean accepted = queue.offer(event);
        if (!accepted) {
            log.warn("monitor.queue_full path={} capacity={}", event.path(), options.getQueueCapacity());
        }
        return accepted;
    }

    public boolean submit(Path path) {
        return submit(new FileEvent(path, clock.instant()));
    }

    /**
     * Asks the dispatch loop to finish after the event in hand.
     */
    public void stop() {
        stopRequested = true;
    }

    /**
     * Runs the period to completion on the calling thread. Can be called once.
     */
    public PeriodSnapshot run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Monitoring period already started");
        }
        try (LogContext ctx = LogContext.forPeriod(periodDate.toString())) {
            log.info("monitor.started date={} workUnits={} deadline={}", periodDate, states.size(), deadline);
            if (eventSource != null) {
                eventSource.start(this::submit);
            }
            try {
                TerminationReason reason = dispatch();
                return close(reason);
            } finally {
                if (eventSource != null) {
                    eventSource.close();
                }
            }
        }
    }

    /**
     * Looks up the last archived file of a work unit and category, up to the period date.
     */
    public HistoricalLookupResult lookupHistory(String identifier, FileCategory category) {
        WorkUnitIdentity identity = resolver.getRegistry().find(identifier)
                .orElseThrow(() -> new IllegalArgumentException("Unknown work unit: " + identifier));
        return historicalSearch.findLastSatisfying(identity, category, periodDate);
    }

    /**
     * Live state of a work unit. State is not synchronized: call this only from the thread
     * that calls {@link #run()}, before it starts or after it returns. Other threads use
     * {@link #latestStatus()}.
     */
    public Optional<WorkUnitState> getState(String identifier) {
        return Optional.ofNullable(states.get(identifier));
    }

    /**
     * Builds a status report from live state. Same threading rule as {@link #getState(String)}.
     */
    public StatusReport currentStatus() {
        int satisfied = 0;
        int partial = 0;
        int pending = 0;
        Map<String, Set<FileCategory>> outstanding = new LinkedHashMap<>();
        for (WorkUnitState state : states.values()) {
            switch (state.status()) {
                case SATISFIED -> satisfied++;
                case PARTIALLY_SATISFIED -> partial++;
                case PENDING -> pending++;
            }
            if (!state.isSatisfied()) {
                outstanding.put(state.getIdentity().identifier(), state.outstanding());
            }
        }
        Instant now = clock.instant();
        boolean urgent = !outstanding.isEmpty()
                && (!LocalTime.now(clock).isBefore(options.getUrgentAfter())
                || outstanding.size() <= options.getUrgentRemaining());
        return new StatusReport(now, periodDate, states.size(), satisfied, partial, pending, outstanding, urgent);
    }

    /**
     * The last status published by the dispatch loop. Safe to call from any thread; it is
     * refreshed after every handled event, at every status tick and when the period closes.
     */
    public StatusReport latestStatus() {
        return latestStatus;
    }

    private TerminationReason dispatch() {
        Instant nextTick = clock.instant().plus(options.getStatusInterval());
        while (true) {
            if (allSatisfied()) {
                return TerminationReason.ALL_SATISFIED;
            }
            if (stopRequested) {
                return TerminationReason.STOPPED;
            }
            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                return TerminationReason.DEADLINE;
            }
            if (!now.isBefore(nextTick)) {
                latestStatus = currentStatus();
                reporter.onStatus(latestStatus);
                nextTick = now.plus(options.getStatusInterval());
            }

            long waitMillis = Math.max(1L, Math.min(
                    Duration.between(now, nextTick).toMillis(),
                    Duration.between(now, deadline).toMillis()));
            FileEvent event;
            try {
                event = queue.poll(waitMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("monitor.interrupted date={}", periodDate);
                return TerminationReason.STOPPED;
            }
            if (event != null) {
                handle(event);
                latestStatus = currentStatus();
            }
        }
    }

    void handle(FileEvent event) {
        try (LogContext ctx = LogContext.forEvent(LogContext.generateCorrelationId(), event.fileName())) {
            try {
                ResolutionResult result = resolver.resolve(event.path());
                if (result.isResolved()) {
                    apply(event, result.getResolved().get());
                } else {
                    Rejection rejection = result.getRejection().get();
                    log.info("event.rejected path={} reason={}", event.path(), rejection.reason());
                    reporter.onRejected(event.path(), rejection);
                }
            } catch (RuntimeException e) {
                metricsService.recordEventFailure();
                log.error("event.failed path={} error={}", event.path(), e.getMessage(), e);
            }
        }
    }

    private void apply(FileEvent event, ResolvedFile file) {
        WorkUnitState state = states.get(file.identity().identifier());
        if (state == null) {
            log.warn("event.unknown_work_unit workUnit={}", file.identity().identifier());
            return;
        }
        CollectionStatus before = state.status();
        boolean changed = state.markSatisfied(file.category(),
                Satisfaction.live(file.fileName(), event.path(), file.fileDate(), event.detectedAt()));
        log.info("event.accepted workUnit={} category={} status={} previous={} changed={}",
                file.identity().identifier(), file.category(), state.status(), before, changed);
        reporter.onResolved(file);
    }

    private boolean allSatisfied() {
        return states.values().stream().allMatch(WorkUnitState::isSatisfied);
    }

    private PeriodSnapshot close(TerminationReason reason) {
        Map<String, Map<FileCategory, HistoricalLookupResult>> lookups = new LinkedHashMap<>();
        if (reason == TerminationReason.DEADLINE && options.isBackfillOnDeadline()) {
            lookups = backfill();
        }
        latestStatus = currentStatus();
        reporter.onStatus(latestStatus);

        Map<String, CollectionStatus> statuses = new LinkedHashMap<>();
        List<CategoryOutcome> outcomes = new ArrayList<>();
        for (WorkUnitState state : states.values()) {
            String identifier = state.getIdentity().identifier();
            statuses.put(identifier, state.status());
            Map<FileCategory, HistoricalLookupResult> unitLookups = lookups.getOrDefault(identifier, Map.of());
            for (FileCategory category : state.getRequiredCategories()) {
                outcomes.add(new CategoryOutcome(identifier, category,
                        state.satisfaction(category).orElse(null), unitLookups.get(category)));
            }
        }

        PeriodSnapshot snapshot = new PeriodSnapshot(periodDate, reason, clock.instant(), statuses, outcomes);
        log.info("monitor.closed date={} reason={} satisfied={}/{}",
                periodDate, reason, snapshot.satisfiedCount(), states.size());
        reporter.onPeriodClosed(snapshot);
        return snapshot;
    }

    private Map<String, Map<FileCategory, HistoricalLookupResult>> backfill() {
        Map<String, Map<FileCategory, HistoricalLookupResult>> lookups = new LinkedHashMap<>();
        for (WorkUnitState state : states.values()) {
            WorkUnitIdentity identity = state.getIdentity();
            for (FileCategory category : state.outstanding()) {
                try (LogContext ctx = LogContext.forBackfill(identity.identifier(), category.name())) {
                    HistoricalLookupResult result = historicalSearch.findLastSatisfying(identity, category, periodDate);
                    metricsService.recordBackfill(result.strategy());
                    lookups.computeIfAbsent(identity.identifier(), k -> new EnumMap<>(FileCategory.class))
                            .put(category, result);
                    if (result.isFound()) {
                        state.markSatisfied(category, Satisfaction.backfill(result.path(), result.effectiveDate(), clock.instant()));
                    }
                    log.info("backfill.done strategy={} explanation={}", result.strategy(), result.explanation());
                } catch (RuntimeException e) {
                    log.error("backfill.failed workUnit={} category={} error={}",
                            identity.identifier(), category, e.getMessage(), e);
                }
            }
        }
        return lookups;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IdentityResolver resolver;
        private HistoricalSearch historicalSearch;
        private CollectionReporter reporter = new LoggingCollectionReporter();
        private MonitorOptions options = MonitorOptions.defaults();
        private Clock clock = Clock.systemDefaultZone();
        private MetricsService metricsService = NoOpMetricsService.INSTANCE;
        private FileEventSource eventSource;

        public Builder resolver(IdentityResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder historicalSearch(HistoricalSearch historicalSearch) {
            this.historicalSearch = historicalSearch;
            return this;
        }

        public Builder reporter(CollectionReporter reporter) {
            this.reporter = reporter;
            return this;
        }

        public Builder options(MonitorOptions options) {
            this.options = options;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Optional. Without a source, events arrive only through {@link #submit(Path)}.
         */
        public Builder eventSource(FileEventSource eventSource) {
            this.eventSource = eventSource;
            return this;
        }

        public MonitorCoordinator build() {
            Objects.requireNonNull(resolver, "resolver is required");
            Objects.requireNonNull(historicalSearch, "historicalSearch is required");
            Objects.requireNonNull(reporter, "reporter is required");
            Objects.requireNonNull(options, "options is required");
            Objects.requireNonNull(clock, "clock is required");
            if (metricsService == null) {
                metricsService = NoOpMetricsService.INSTANCE;
            }
            if (resolver.getRegistry().isEmpty()) {
                throw new IllegalArgumentException("Cannot monitor a period without work units");
            }
            return new MonitorCoordinator(this);
        }
    }
}
