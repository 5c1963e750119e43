package com.mapsheet.collection.core.model;

/**
 * What a {@link Target} looks for in an input string.
 */
public enum TargetKind {
    /**
     * A work-unit name or alias, matched against candidates.
     */
    IDENTIFIER,

    /**
     * A calendar date, extracted by pattern.
     */
    DATE,

    /**
     * A file-category keyword, matched against candidates.
     */
    FILE_CATEGORY,

    /**
     * The trailing file extension, compared for equality with candidates.
     */
    EXTENSION,

    /**
     * Any value extracted by pattern.
     */
    PATTERN;

    /**
     * Returns true if targets of this kind extract values by regular expression
     * rather than matching a candidate list.
     */
    public boolean isPatternBased() {
        return this == DATE || this == PATTERN;
    }
}
