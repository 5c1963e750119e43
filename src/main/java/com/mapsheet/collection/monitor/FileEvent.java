package com.mapsheet.collection.monitor;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * A file that appeared in the watched tree.
 */
public record FileEvent(Path path, Instant detectedAt) {

    public FileEvent {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(detectedAt, "detectedAt is required");
    }

    public String fileName() {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }
}
