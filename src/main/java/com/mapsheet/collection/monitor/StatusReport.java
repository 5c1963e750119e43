package com.mapsheet.collection.monitor;

import com.mapsheet.collection.core.model.FileCategory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Periodic progress of the active period.
 *
 * @param outstanding still missing categories per work unit identifier, in registry order
 * @param urgent      late in the day or few work units left
 */
public record StatusReport(
        Instant at,
        LocalDate periodDate,
        int totalWorkUnits,
        int satisfied,
        int partiallySatisfied,
        int pending,
        Map<String, Set<FileCategory>> outstanding,
        boolean urgent
) {
    public StatusReport {
        outstanding = Collections.unmodifiableMap(new LinkedHashMap<>(outstanding));
    }

    public int outstandingWorkUnits() {
        return outstanding.size();
    }

    /**
     * One line per outstanding work unit, e.g. {@code MAHROUS: PLANNED_ROUTES}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(periodDate).append(": ").append(satisfied).append('/').append(totalWorkUnits)
                .append(" work units complete");
        if (urgent) {
            sb.append(" [URGENT]");
        }
        outstanding.forEach((identifier, categories) ->
                sb.append(System.lineSeparator()).append("  ").append(identifier).append(": ").append(categories));
        return sb.toString();
    }
}
