package com.mapsheet.collection.core.model;

/**
 * Candidate matching strategy configured on a {@link Target}.
 */
public enum MatchStrategyType {
    EXACT,
    FUZZY,
    /**
     * Exact first, fuzzy on failure.
     */
    HYBRID
}
