package com.mapsheet.collection.monitor;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * The file that satisfied a category, and how it was obtained.
 */
public record Satisfaction(String fileName, Path path, LocalDate fileDate, SatisfactionSource source, Instant at) {

    public Satisfaction {
        Objects.requireNonNull(fileName, "fileName is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(at, "at is required");
    }

    public static Satisfaction live(String fileName, Path path, LocalDate fileDate, Instant at) {
        return new Satisfaction(fileName, path, fileDate, SatisfactionSource.LIVE, at);
    }

    public static Satisfaction backfill(Path path, LocalDate fileDate, Instant at) {
        return new Satisfaction(path.getFileName().toString(), path, fileDate, SatisfactionSource.BACKFILL, at);
    }
}
