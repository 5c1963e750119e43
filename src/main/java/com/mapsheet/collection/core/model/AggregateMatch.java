package com.mapsheet.collection.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One input string matched against a set of targets.
 *
 * <p>Completeness is derived from the unmatched required target list rather than stored,
 * so the two always agree.</p>
 */
public final class AggregateMatch {

    private final String source;
    private final Map<String, MatchOutcome> outcomes;
    private final double overallScore;
    private final List<String> unmatchedRequired;

    public AggregateMatch(String source, Map<String, MatchOutcome> outcomes,
                          double overallScore, List<String> unmatchedRequired) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        this.unmatchedRequired = List.copyOf(unmatchedRequired);
        if (overallScore < 0.0 || overallScore > 1.0) {
            throw new IllegalArgumentException("overallScore must be between 0.0 and 1.0");
        }
        this.overallScore = overallScore;
    }

    public String getSource() {
        return source;
    }

    /**
     * Per-target outcomes keyed by target name.
     */
    public Map<String, MatchOutcome> getOutcomes() {
        return outcomes;
    }

    public Optional<MatchOutcome> getOutcome(String targetName) {
        return Optional.ofNullable(outcomes.get(targetName));
    }

    /**
     * Returns the matched value of a target, if it matched.
     */
    public Optional<String> getMatchedValue(String targetName) {
        return getOutcome(targetName).flatMap(MatchOutcome::value);
    }

    public boolean hasMatch(String targetName) {
        return getOutcome(targetName).map(MatchOutcome::isMatched).orElse(false);
    }

    public double getOverallScore() {
        return overallScore;
    }

    public List<String> getUnmatchedRequired() {
        return unmatchedRequired;
    }

    /**
     * True iff every required target matched.
     */
    public boolean isComplete() {
        return unmatchedRequired.isEmpty();
    }

    @Override
    public String toString() {
        return "AggregateMatch{" +
                "source='" + source + '\'' +
                ", overallScore=" + String.format("%.3f", overallScore) +
                ", complete=" + isComplete() +
                ", unmatchedRequired=" + unmatchedRequired +
                '}';
    }
}
