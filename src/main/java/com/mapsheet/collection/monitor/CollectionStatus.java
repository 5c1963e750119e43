package com.mapsheet.collection.monitor;

/**
 * Completion status of a work unit for the active period. Only moves forward.
 */
public enum CollectionStatus {
    PENDING,
    PARTIALLY_SATISFIED,
    SATISFIED
}
