package com.mapsheet.collection.monitor;

/**
 * Why a monitoring period ended.
 */
public enum TerminationReason {
    ALL_SATISFIED,
    DEADLINE,
    STOPPED
}
