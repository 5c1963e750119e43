package com.mapsheet.collection.resolve;

import com.mapsheet.collection.core.model.AggregateMatch;
import com.mapsheet.collection.core.model.FileCategory;
import com.mapsheet.collection.core.model.MatchKind;
import com.mapsheet.collection.core.model.MatchOutcome;
import com.mapsheet.collection.core.model.WorkUnitIdentity;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A file accepted as a submission of one work unit and category.
 *
 * @param fileName  the file name that was resolved
 * @param path      where the file was found, null when only a name was resolved
 * @param identity  the work unit the name resolved to
 * @param category  the file category
 * @param fileDate  the date carried in the file name
 * @param match     the full per-target match
 */
public record ResolvedFile(
        String fileName,
        Path path,
        WorkUnitIdentity identity,
        FileCategory category,
        LocalDate fileDate,
        AggregateMatch match
) {
    public ResolvedFile {
        Objects.requireNonNull(fileName, "fileName is required");
        Objects.requireNonNull(identity, "identity is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(fileDate, "fileDate is required");
        Objects.requireNonNull(match, "match is required");
    }

    /**
     * How the work unit name was recognized.
     */
    public MatchKind identifierMatchKind() {
        return match.getOutcome(IdentityResolver.IDENTIFIER_TARGET)
                .map(MatchOutcome::kind)
                .orElse(MatchKind.NONE);
    }

    public double identifierScore() {
        return match.getOutcome(IdentityResolver.IDENTIFIER_TARGET)
                .map(MatchOutcome::score)
                .orElse(0.0);
    }
}
