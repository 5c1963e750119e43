package com.mapsheet.collection.resolve;

import com.mapsheet.collection.cache.CacheConfig;
import com.mapsheet.collection.core.model.MatchStrategyType;
import com.mapsheet.collection.core.model.Target;
import com.mapsheet.collection.matching.DateTokens;
import com.mapsheet.collection.similarity.SimilarityWeights;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Options for resolving file names to work units.
 * Configures thresholds, strategies, accepted extensions and similarity weights.
 */
public class ResolverOptions {

    private static final double DEFAULT_FUZZY_THRESHOLD = Target.DEFAULT_FUZZY_THRESHOLD;

    private final double fuzzyThreshold;
    private final MatchStrategyType identifierStrategy;
    private final MatchStrategyType categoryStrategy;
    private final List<String> acceptedExtensions;
    private final List<String> datePatterns;
    private final boolean caseSensitive;
    private final boolean prefixBiased;
    private final SimilarityWeights similarityWeights;
    private final CacheConfig cacheConfig;

    private ResolverOptions(Builder builder) {
        this.fuzzyThreshold = builder.fuzzyThreshold;
        this.identifierStrategy = builder.identifierStrategy;
        this.categoryStrategy = builder.categoryStrategy;
        this.acceptedExtensions = List.copyOf(builder.acceptedExtensions);
        this.datePatterns = List.copyOf(builder.datePatterns);
        this.caseSensitive = builder.caseSensitive;
        this.prefixBiased = builder.prefixBiased;
        this.similarityWeights = builder.similarityWeights;
        this.cacheConfig = builder.cacheConfig;
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public MatchStrategyType getIdentifierStrategy() {
        return identifierStrategy;
    }

    public MatchStrategyType getCategoryStrategy() {
        return categoryStrategy;
    }

    /**
     * Accepted extensions, lower case and without the leading dot.
     */
    public List<String> getAcceptedExtensions() {
        return acceptedExtensions;
    }

    public List<String> getDatePatterns() {
        return datePatterns;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public boolean isPrefixBiased() {
        return prefixBiased;
    }

    public SimilarityWeights getSimilarityWeights() {
        return similarityWeights;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public static ResolverOptions defaults() {
        return builder().build();
    }

    /**
     * Exact matching only: no fuzzy fallback for names or categories.
     */
    public static ResolverOptions strict() {
        return builder()
                .identifierStrategy(MatchStrategyType.EXACT)
                .categoryStrategy(MatchStrategyType.EXACT)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double fuzzyThreshold = DEFAULT_FUZZY_THRESHOLD;
        private MatchStrategyType identifierStrategy = MatchStrategyType.HYBRID;
        private MatchStrategyType categoryStrategy = MatchStrategyType.HYBRID;
        private List<String> acceptedExtensions = List.of("kmz");
        private List<String> datePatterns = DateTokens.defaultPatterns();
        private boolean caseSensitive = false;
        private boolean prefixBiased = false;
        private SimilarityWeights similarityWeights = SimilarityWeights.defaultWeights();
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder fuzzyThreshold(double fuzzyThreshold) {
            if (fuzzyThreshold < 0.0 || fuzzyThreshold > 1.0) {
                throw new IllegalArgumentException("fuzzyThreshold must be between 0.0 and 1.0");
            }
            this.fuzzyThreshold = fuzzyThreshold;
            return this;
        }

        public Builder identifierStrategy(MatchStrategyType identifierStrategy) {
            this.identifierStrategy = Objects.requireNonNull(identifierStrategy, "identifierStrategy must not be null");
            return this;
        }

        public Builder categoryStrategy(MatchStrategyType categoryStrategy) {
            this.categoryStrategy = Objects.requireNonNull(categoryStrategy, "categoryStrategy must not be null");
            return this;
        }

        public Builder acceptedExtensions(List<String> acceptedExtensions) {
            if (acceptedExtensions == null || acceptedExtensions.isEmpty()) {
                throw new IllegalArgumentException("acceptedExtensions must not be empty");
            }
            this.acceptedExtensions = acceptedExtensions.stream()
                    .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                    .map(ext -> ext.toLowerCase(Locale.ROOT))
                    .toList();
            return this;
        }

        public Builder datePatterns(List<String> datePatterns) {
            if (datePatterns == null || datePatterns.isEmpty()) {
                throw new IllegalArgumentException("datePatterns must not be empty");
            }
            this.datePatterns = datePatterns;
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        /**
         * Weights the leading characters of work unit names more heavily. Off by default:
         * fuzzy matching already compares whole tokens, and with the bias a one-letter token
         * sharing a name's first letter would clear the default threshold.
         */
        public Builder prefixBiased(boolean prefixBiased) {
            this.prefixBiased = prefixBiased;
            return this;
        }

        public Builder similarityWeights(SimilarityWeights similarityWeights) {
            this.similarityWeights = Objects.requireNonNull(similarityWeights, "similarityWeights must not be null");
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig must not be null");
            return this;
        }

        public ResolverOptions build() {
            return new ResolverOptions(this);
        }
    }
}
