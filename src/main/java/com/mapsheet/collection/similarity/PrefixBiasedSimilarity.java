package com.mapsheet.collection.similarity;

import java.util.Objects;

/**
 * Prefix-biased similarity: blends the similarity of the common-length prefixes with the
 * overall similarity of the two strings.
 * File names carry the identifying token first, so a shared prefix counts for more.
 */
public class PrefixBiasedSimilarity implements SimilarityAlgorithm {

    public static final double DEFAULT_PREFIX_WEIGHT = 0.7;

    private final SimilarityAlgorithm delegate;
    private final double prefixWeight;

    public PrefixBiasedSimilarity(SimilarityAlgorithm delegate) {
        this(delegate, DEFAULT_PREFIX_WEIGHT);
    }

    public PrefixBiasedSimilarity(SimilarityAlgorithm delegate, double prefixWeight) {
        if (prefixWeight < 0.0 || prefixWeight > 1.0) {
            throw new IllegalArgumentException("prefixWeight must be between 0.0 and 1.0");
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.prefixWeight = prefixWeight;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        int prefixLength = Math.min(s1.length(), s2.length());
        double prefixScore = delegate.compute(s1.substring(0, prefixLength), s2.substring(0, prefixLength));
        double overallScore = delegate.compute(s1, s2);
        double combined = prefixScore * prefixWeight + overallScore * (1.0 - prefixWeight);
        return Math.max(0.0, Math.min(1.0, combined));
    }

    @Override
    public String getName() {
        return "PrefixBiased(" + delegate.getName() + ")";
    }

    public double getPrefixWeight() {
        return prefixWeight;
    }
}
