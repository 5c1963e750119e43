package com.mapsheet.collection.history;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of searching prior archive folders for a work unit's submission.
 *
 * @param path          the file found, null for {@link LookupStrategy#NONE}
 * @param strategy      how it was found
 * @param effectiveDate the date carried in the file name, never the folder's date
 * @param explanation   human-readable account of the lookup
 */
public record HistoricalLookupResult(Path path, LookupStrategy strategy, LocalDate effectiveDate, String explanation) {

    public HistoricalLookupResult {
        Objects.requireNonNull(strategy, "strategy is required");
        Objects.requireNonNull(explanation, "explanation is required");
        if ((strategy == LookupStrategy.NONE) != (path == null)) {
            throw new IllegalArgumentException("A path is present exactly when something was found");
        }
    }

    public static HistoricalLookupResult exact(Path path, LocalDate effectiveDate) {
        return new HistoricalLookupResult(path, LookupStrategy.EXACT, effectiveDate,
                "Canonical file found in archive folder for " + effectiveDate);
    }

    public static HistoricalLookupResult fuzzy(Path path, LocalDate effectiveDate, String explanation) {
        return new HistoricalLookupResult(path, LookupStrategy.FUZZY, effectiveDate, explanation);
    }

    public static HistoricalLookupResult none(String explanation) {
        return new HistoricalLookupResult(null, LookupStrategy.NONE, null, explanation);
    }

    public boolean isFound() {
        return strategy != LookupStrategy.NONE;
    }

    public Optional<Path> foundPath() {
        return Optional.ofNullable(path);
    }
}
