package com.mapsheet.collection.monitor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-work-unit satisfaction at the end of a period.
 */
public record PeriodSnapshot(
        LocalDate periodDate,
        TerminationReason terminationReason,
        Instant closedAt,
        Map<String, CollectionStatus> statuses,
        List<CategoryOutcome> outcomes
) {
    public PeriodSnapshot {
        statuses = Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
        outcomes = List.copyOf(outcomes);
    }

    public long satisfiedCount() {
        return statuses.values().stream().filter(status -> status == CollectionStatus.SATISFIED).count();
    }

    public List<CategoryOutcome> outcomesFor(String identifier) {
        return outcomes.stream().filter(outcome -> outcome.identifier().equals(identifier)).toList();
    }

    public List<CategoryOutcome> unsatisfied() {
        return outcomes.stream().filter(outcome -> !outcome.isSatisfied()).toList();
    }
}
