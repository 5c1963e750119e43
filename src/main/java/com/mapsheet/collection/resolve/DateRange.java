package com.mapsheet.collection.resolve;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive range of calendar dates.
 */
public record DateRange(LocalDate from, LocalDate to) {

    public DateRange {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("DateRange end " + to + " is before start " + from);
        }
    }

    public static DateRange single(LocalDate date) {
        return new DateRange(date, date);
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(from) && !date.isAfter(to);
    }

    @Override
    public String toString() {
        return from.equals(to) ? from.toString() : from + ".." + to;
    }
}
