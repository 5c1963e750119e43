package com.mapsheet.collection.resolve;

import java.util.Optional;

/**
 * Outcome of resolving one file name: either a {@link ResolvedFile} or a {@link Rejection}.
 */
public final class ResolutionResult {

    private final ResolvedFile resolved;
    private final Rejection rejection;

    private ResolutionResult(ResolvedFile resolved, Rejection rejection) {
        if ((resolved == null) == (rejection == null)) {
            throw new IllegalArgumentException("Exactly one of resolved or rejection must be set");
        }
        this.resolved = resolved;
        this.rejection = rejection;
    }

    public static ResolutionResult resolved(ResolvedFile resolved) {
        return new ResolutionResult(resolved, null);
    }

    public static ResolutionResult rejected(Rejection rejection) {
        return new ResolutionResult(null, rejection);
    }

    public boolean isResolved() {
        return resolved != null;
    }

    public Optional<ResolvedFile> getResolved() {
        return Optional.ofNullable(resolved);
    }

    public Optional<Rejection> getRejection() {
        return Optional.ofNullable(rejection);
    }

    /**
     * Returns the rejection reason, or empty for resolved files.
     */
    public Optional<RejectionReason> getRejectionReason() {
        return getRejection().map(Rejection::reason);
    }

    @Override
    public String toString() {
        return resolved != null
                ? "Resolved{" + resolved.identity() + ", " + resolved.category() + ", " + resolved.fileDate() + '}'
                : "Rejected{" + rejection + '}';
    }
}
