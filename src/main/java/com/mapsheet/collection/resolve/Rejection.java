package com.mapsheet.collection.resolve;

import com.mapsheet.collection.core.model.AggregateMatch;

import java.util.Objects;

/**
 * A file that was not accepted, with the first failing reason and a human-readable detail.
 */
public record Rejection(RejectionReason reason, String detail, AggregateMatch match) {

    public Rejection {
        Objects.requireNonNull(reason, "reason is required");
        Objects.requireNonNull(detail, "detail is required");
        Objects.requireNonNull(match, "match is required");
    }

    @Override
    public String toString() {
        return reason + ": " + detail;
    }
}
