package com.mapsheet.collection.monitor;

import com.mapsheet.collection.core.model.FileCategory;
import com.mapsheet.collection.history.HistoricalLookupResult;

import java.util.Objects;
import java.util.Optional;

/**
 * End-of-period result of one (work unit, category) pair.
 *
 * @param satisfaction the satisfying file, null when unsatisfied
 * @param lookup       the deadline lookup, null when none was run
 */
public record CategoryOutcome(
        String identifier,
        FileCategory category,
        Satisfaction satisfaction,
        HistoricalLookupResult lookup
) {
    public CategoryOutcome {
        Objects.requireNonNull(identifier, "identifier is required");
        Objects.requireNonNull(category, "category is required");
    }

    public boolean isSatisfied() {
        return satisfaction != null;
    }

    public Optional<HistoricalLookupResult> lookupResult() {
        return Optional.ofNullable(lookup);
    }

    public String describe() {
        if (satisfaction == null) {
            return lookup != null ? "unsatisfied (" + lookup.explanation() + ")" : "unsatisfied";
        }
        if (satisfaction.source() == SatisfactionSource.BACKFILL) {
            return "backfilled from historical search on " + satisfaction.fileDate() + ": " + satisfaction.path();
        }
        return satisfaction.path() != null ? satisfaction.path().toString() : satisfaction.fileName();
    }
}
