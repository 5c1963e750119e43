package com.mapsheet.collection.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * A named matching goal evaluated against every input string.
 * Immutable; all tuning (strategy, threshold, case handling, weight) travels with the target
 * so that call sites never pass matching parameters separately.
 */
public final class Target {

    public static final double DEFAULT_FUZZY_THRESHOLD = 0.65;

    private final String name;
    private final TargetKind kind;
    private final List<String> candidates;
    private final List<Pattern> patterns;
    private final MatchStrategyType strategy;
    private final double fuzzyThreshold;
    private final boolean caseSensitive;
    private final boolean prefixBiased;
    private final boolean required;
    private final double weight;
    private final Predicate<String> validator;

    private Target(Builder builder) {
        this.name = builder.name;
        this.kind = builder.kind;
        this.candidates = List.copyOf(builder.candidates);
        int flags = builder.caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        List<Pattern> compiled = new ArrayList<>();
        for (String regex : builder.patterns) {
            compiled.add(Pattern.compile(regex, flags));
        }
        this.patterns = List.copyOf(compiled);
        this.strategy = builder.strategy;
        this.fuzzyThreshold = builder.fuzzyThreshold;
        this.caseSensitive = builder.caseSensitive;
        this.prefixBiased = builder.prefixBiased;
        this.required = builder.required;
        this.weight = builder.weight;
        this.validator = builder.validator;
    }

    public String getName() {
        return name;
    }

    public TargetKind getKind() {
        return kind;
    }

    /**
     * Candidates in their supplied order. Order decides ties.
     */
    public List<String> getCandidates() {
        return candidates;
    }

    public List<Pattern> getPatterns() {
        return patterns;
    }

    public MatchStrategyType getStrategy() {
        return strategy;
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public boolean isPrefixBiased() {
        return prefixBiased;
    }

    public boolean isRequired() {
        return required;
    }

    public double getWeight() {
        return weight;
    }

    /**
     * Checks a matched or extracted value against this target's validator.
     */
    public boolean accepts(String value) {
        return validator.test(value);
    }

    @Override
    public String toString() {
        return "Target{" +
                "name='" + name + '\'' +
                ", kind=" + kind +
                ", strategy=" + strategy +
                ", candidates=" + candidates.size() +
                ", patterns=" + patterns.size() +
                ", fuzzyThreshold=" + fuzzyThreshold +
                ", required=" + required +
                ", weight=" + weight +
                '}';
    }

    public static Builder builder(String name, TargetKind kind) {
        return new Builder().name(name).kind(kind);
    }

    public static class Builder {
        private String name;
        private TargetKind kind;
        private List<String> candidates = List.of();
        private List<String> patterns = List.of();
        private MatchStrategyType strategy = MatchStrategyType.HYBRID;
        private double fuzzyThreshold = DEFAULT_FUZZY_THRESHOLD;
        private boolean caseSensitive = false;
        private boolean prefixBiased = false;
        private boolean required = true;
        private double weight = 1.0;
        private Predicate<String> validator = value -> true;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(TargetKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder candidates(List<String> candidates) {
            this.candidates = Objects.requireNonNull(candidates, "candidates must not be null");
            return this;
        }

        public Builder patterns(List<String> patterns) {
            this.patterns = Objects.requireNonNull(patterns, "patterns must not be null");
            return this;
        }

        public Builder pattern(String pattern) {
            return patterns(List.of(pattern));
        }

        public Builder strategy(MatchStrategyType strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder fuzzyThreshold(double fuzzyThreshold) {
            if (fuzzyThreshold < 0.0 || fuzzyThreshold > 1.0) {
                throw new IllegalArgumentException("fuzzyThreshold must be between 0.0 and 1.0");
            }
            this.fuzzyThreshold = fuzzyThreshold;
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder prefixBiased(boolean prefixBiased) {
            this.prefixBiased = prefixBiased;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder weight(double weight) {
            if (!(weight > 0.0)) {
                throw new IllegalArgumentException("weight must be > 0");
            }
            this.weight = weight;
            return this;
        }

        public Builder validator(Predicate<String> validator) {
            this.validator = Objects.requireNonNull(validator, "validator must not be null");
            return this;
        }

        public Target build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(kind, "kind is required");
            Objects.requireNonNull(strategy, "strategy is required");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            if (kind.isPatternBased() && patterns.isEmpty()) {
                throw new IllegalArgumentException("Target '" + name + "' of kind " + kind + " needs at least one pattern");
            }
            return new Target(this);
        }
    }
}
