package com.mapsheet.collection.core.model;

/**
 * The sub-strategy that produced a {@link MatchOutcome}.
 */
public enum MatchKind {
    /**
     * Candidate found by containment or equality.
     */
    EXACT,

    /**
     * Candidate found by similarity above the target's threshold.
     */
    FUZZY,

    /**
     * Value extracted by a regular expression.
     */
    PATTERN,

    /**
     * Nothing matched.
     */
    NONE
}
