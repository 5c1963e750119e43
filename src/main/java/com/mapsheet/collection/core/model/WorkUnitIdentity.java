package com.mapsheet.collection.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Stable identifier set of one work unit (survey team / mapsheet).
 *
 * @param identifier canonical file-name stem, e.g. {@code MAHROUS} or {@code Team_317}
 * @param teamNumber human-assigned team number, may be null
 * @param aliases    other accepted spellings, transliterations and display names
 */
public record WorkUnitIdentity(String identifier, String teamNumber, List<String> aliases) {

    public WorkUnitIdentity {
        Objects.requireNonNull(identifier, "identifier is required");
        if (identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
    }

    public static WorkUnitIdentity of(String identifier, String... aliases) {
        return new WorkUnitIdentity(identifier, null, List.of(aliases));
    }

    /**
     * Returns the identifier followed by every distinct, non-blank alias.
     */
    public List<String> allNames() {
        Set<String> names = new LinkedHashSet<>();
        names.add(identifier);
        for (String alias : aliases) {
            if (alias != null && !alias.isBlank()) {
                names.add(alias.trim());
            }
        }
        return new ArrayList<>(names);
    }

    @Override
    public String toString() {
        return teamNumber != null ? identifier + " (team " + teamNumber + ")" : identifier;
    }
}
