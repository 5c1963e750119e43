package com.mapsheet.collection.history;

import com.mapsheet.collection.core.model.FileCategory;
import com.mapsheet.collection.core.model.WorkUnitIdentity;
import com.mapsheet.collection.metrics.MetricsService;
import com.mapsheet.collection.metrics.NoOpMetricsService;
import com.mapsheet.collection.resolve.Identification;
import com.mapsheet.collection.resolve.IdentityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Finds the most recent archived submission of a work unit and category.
 *
 * <p>The search window is the reference date and the {@code lookbackDays} days before it.
 * The exact pass walks the window backwards looking for the canonical file name of each date
 * in every day folder of the window, and stops at the first hit. Only when it finds nothing
 * does the fuzzy pass scan every day folder of the window, resolving each file name; the latest date carried in a matching file name wins,
 * whatever folder the file sits in. Equal dates go to the lexically later file name.</p>
 *
 * <p>Folder scans run on an internal fixed pool; {@link #close()} shuts it down.</p>
 */
public class HistoricalSearch implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HistoricalSearch.class);

    private static final Comparator<Candidate> MOST_RECENT = Comparator
            .comparing(Candidate::fileDate)
            .thenComparing(candidate -> candidate.path().getFileName().toString());

    private final ArchiveLayout layout;
    private final HistoricalSearchOptions options;
    private final IdentityResolver resolver;
    private final MetricsService metricsService;
    private final ExecutorService executor;

    public HistoricalSearch(ArchiveLayout layout, IdentityResolver resolver) {
        this(layout, HistoricalSearchOptions.defaults(), resolver, NoOpMetricsService.INSTANCE);
    }

    public HistoricalSearch(ArchiveLayout layout, HistoricalSearchOptions options,
                            IdentityResolver resolver, MetricsService metricsService) {
        this.layout = Objects.requireNonNull(layout, "layout is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(options.getParallelism(), runnable -> {
            Thread thread = new Thread(runnable, "history-scan-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Finds the last file satisfying {@code category} for {@code identity} dated up to
     * {@code upTo}'s window.
     */
    public HistoricalLookupResult findLastSatisfying(WorkUnitIdentity identity, FileCategory category, LocalDate upTo) {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(upTo, "upTo must not be null");

        long start = System.nanoTime();
        HistoricalLookupResult result = findExact(identity, category, upTo)
                .orElseGet(() -> findFuzzy(identity, category, upTo));
        metricsService.recordHistoricalSearchDuration(result.strategy(), Duration.ofNanos(System.nanoTime() - start));

        log.info("history.lookup workUnit={} category={} upTo={} strategy={} path={}",
                identity.identifier(), category, upTo, result.strategy(), result.path());
        return result;
    }

    public ArchiveLayout getLayout() {
        return layout;
    }

    public HistoricalSearchOptions getOptions() {
        return options;
    }

    /**
     * Looks for the canonical name of each date of the window, newest first, in every day
     * folder of the window. A correctly named file is found whatever day folder it was filed under.
     */
    Optional<HistoricalLookupResult> findExact(WorkUnitIdentity identity, FileCategory category, LocalDate upTo) {
        List<LocalDate> window = new ArrayList<>();
        for (int back = 0; back <= options.getLookbackDays(); back++) {
            LocalDate date = upTo.minusDays(back);
            if (Files.isDirectory(layout.dayFolder(date))) {
                window.add(date);
            }
        }
        for (int back = 0; back <= options.getLookbackDays(); back++) {
            LocalDate nameDate = upTo.minusDays(back);
            String name = layout.canonicalFileName(identity, category, nameDate);
            for (LocalDate folderDate : window) {
                for (Path folder : List.of(layout.categoryFolder(folderDate, category), layout.dayFolder(folderDate))) {
                    Path candidate = folder.resolve(name);
                    if (Files.isRegularFile(candidate)) {
                        log.debug("history.exact_hit path={} folderDate={}", candidate, folderDate);
                        return Optional.of(HistoricalLookupResult.exact(candidate, nameDate));
                    }
                }
            }
        }
        return Optional.empty();
    }

    HistoricalLookupResult findFuzzy(WorkUnitIdentity identity, FileCategory category, LocalDate upTo) {
        List<Future<List<Candidate>>> futures = new ArrayList<>();
        int folders = 0;
        for (int back = 0; back <= options.getLookbackDays(); back++) {
            Path dayFolder = layout.dayFolder(upTo.minusDays(back));
            if (Files.isDirectory(dayFolder)) {
                folders++;
                futures.add(executor.submit(() -> scanFolder(dayFolder, identity, category)));
            }
        }

        List<Candidate> candidates = new ArrayList<>();
        for (Future<List<Candidate>> future : futures) {
            try {
                candidates.addAll(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                return HistoricalLookupResult.none("Lookup interrupted before completion");
            } catch (ExecutionException e) {
                log.warn("history.scan_failed workUnit={} error={}", identity.identifier(), e.getCause().toString());
            }
        }

        Optional<Candidate> best = candidates.stream().max(MOST_RECENT);
        if (best.isEmpty()) {
            return HistoricalLookupResult.none(String.format(
                    "No %s file for %s in %d archive folders from %s back %d days",
                    category, identity.identifier(), folders, upTo, options.getLookbackDays()));
        }
        Candidate found = best.get();
        return HistoricalLookupResult.fuzzy(found.path(), found.fileDate(), String.format(
                "Resolved '%s' to %s / %s among %d candidates; file name dated %s",
                found.path().getFileName(), identity.identifier(), category, candidates.size(), found.fileDate()));
    }

    private List<Candidate> scanFolder(Path folder, WorkUnitIdentity identity, FileCategory category) {
        List<Candidate> matches = new ArrayList<>();
        try (Stream<Path> files = Files.walk(folder)) {
            files.filter(Files::isRegularFile)
                    .filter(layout::hasArchiveExtension)
                    .forEach(file -> {
                        Optional<Identification> identification = resolver.identify(file.getFileName().toString());
                        if (identification.isPresent()
                                && identification.get().identity().identifier().equals(identity.identifier())
                                && identification.get().category() == category) {
                            matches.add(new Candidate(file, identification.get().fileDate()));
                        }
                    });
        } catch (IOException | UncheckedIOException e) {
            log.warn("history.folder_unreadable folder={} error={}", folder, e.getMessage());
        }
        return matches;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private record Candidate(Path path, LocalDate fileDate) {
    }
}
