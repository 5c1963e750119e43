package com.mapsheet.collection.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of attempting one {@link Target} against one input string.
 *
 * <p>{@code matchedValue} is the candidate (or the extracted value for pattern targets) and
 * {@code matchedText} the part of the input that produced it. When nothing matched, score,
 * confidence and span are always empty; {@code closestScore} still reports the best
 * similarity seen below threshold so that rejections can be explained.</p>
 */
public record MatchOutcome(
        String matchedValue,
        String matchedText,
        double score,
        double confidence,
        MatchSpan span,
        MatchKind kind,
        double closestScore
) {
    public MatchOutcome {
        Objects.requireNonNull(kind, "kind is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (matchedValue == null) {
            if (score != 0.0 || confidence != 0.0 || span != null || kind != MatchKind.NONE) {
                throw new IllegalArgumentException("An unmatched outcome carries no score, confidence, span or kind");
            }
        } else if (kind == MatchKind.NONE) {
            throw new IllegalArgumentException("A matched outcome must name the strategy that produced it");
        }
    }

    /**
     * Creates a no-match outcome.
     */
    public static MatchOutcome noMatch() {
        return noMatch(0.0);
    }

    /**
     * Creates a no-match outcome remembering the best similarity that fell short.
     */
    public static MatchOutcome noMatch(double closestScore) {
        return new MatchOutcome(null, null, 0.0, 0.0, null, MatchKind.NONE, closestScore);
    }

    /**
     * Creates an exact outcome (score and confidence 1.0).
     */
    public static MatchOutcome exact(String candidate, String matchedText, MatchSpan span) {
        return new MatchOutcome(candidate, matchedText, 1.0, 1.0, span, MatchKind.EXACT, 1.0);
    }

    /**
     * Creates a fuzzy outcome whose confidence equals its similarity score.
     */
    public static MatchOutcome fuzzy(String candidate, String matchedText, MatchSpan span, double score) {
        return new MatchOutcome(candidate, matchedText, score, score, span, MatchKind.FUZZY, score);
    }

    /**
     * Creates a pattern-extraction outcome.
     */
    public static MatchOutcome pattern(String value, MatchSpan span, double confidence) {
        return new MatchOutcome(value, value, 1.0, confidence, span, MatchKind.PATTERN, 1.0);
    }

    /**
     * Returns true if this outcome found something.
     */
    public boolean isMatched() {
        return matchedValue != null;
    }

    public Optional<String> value() {
        return Optional.ofNullable(matchedValue);
    }

    public Optional<MatchSpan> matchedSpan() {
        return Optional.ofNullable(span);
    }
}
