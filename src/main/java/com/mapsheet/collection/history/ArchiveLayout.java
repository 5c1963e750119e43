package com.mapsheet.collection.history;

import com.mapsheet.collection.core.model.FileCategory;
import com.mapsheet.collection.core.model.WorkUnitIdentity;
import com.mapsheet.collection.matching.DateTokens;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Folder layout of the submission archive:
 * {@code <root>/<yyyyMM>/<yyyyMMdd>/<category folder>/<identifier>_<category token>_<yyyyMMdd>.<ext>}.
 */
public final class ArchiveLayout {

    public static final String DEFAULT_EXTENSION = "kmz";

    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("uuuuMM");

    private final Path root;
    private final String extension;

    public ArchiveLayout(Path root) {
        this(root, DEFAULT_EXTENSION);
    }

    public ArchiveLayout(Path root, String extension) {
        this.root = Objects.requireNonNull(root, "root is required");
        Objects.requireNonNull(extension, "extension is required");
        String bare = extension.startsWith(".") ? extension.substring(1) : extension;
        if (bare.isBlank()) {
            throw new IllegalArgumentException("extension must not be blank");
        }
        this.extension = bare.toLowerCase(Locale.ROOT);
    }

    public Path getRoot() {
        return root;
    }

    public String getExtension() {
        return extension;
    }

    public Path monthFolder(LocalDate date) {
        return root.resolve(MONTH.format(date));
    }

    public Path dayFolder(LocalDate date) {
        return monthFolder(date).resolve(DateTokens.format(date));
    }

    public Path categoryFolder(LocalDate date, FileCategory category) {
        return dayFolder(date).resolve(category.folderName());
    }

    /**
     * The name a correctly submitted file carries, e.g.
     * {@code MAHROUS_finished_points_and_tracks_20250830.kmz}.
     */
    public String canonicalFileName(WorkUnitIdentity identity, FileCategory category, LocalDate date) {
        return identity.identifier() + "_" + category.fileToken() + "_" + DateTokens.format(date) + "." + extension;
    }

    public Path canonicalPath(WorkUnitIdentity identity, FileCategory category, LocalDate date) {
        return categoryFolder(date, category).resolve(canonicalFileName(identity, category, date));
    }

    public boolean hasArchiveExtension(Path file) {
        Path name = file.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith("." + extension);
    }
}
