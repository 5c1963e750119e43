package com.mapsheet.collection.monitor;

public enum SatisfactionSource {
    /**
     * A file event observed during the period.
     */
    LIVE,
    /**
     * A historical lookup at the deadline.
     */
    BACKFILL
}
