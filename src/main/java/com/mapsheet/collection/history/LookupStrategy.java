package com.mapsheet.collection.history;

/**
 * How a historical lookup found its file.
 */
public enum LookupStrategy {
    /**
     * The canonical file name was present in a dated archive folder.
     */
    EXACT,
    /**
     * A differently named file resolved to the requested work unit and category.
     */
    FUZZY,
    NONE
}
