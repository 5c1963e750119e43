package com.mapsheet.collection.similarity;

/**
 * Configuration for similarity algorithm weights in composite scoring.
 */
public record SimilarityWeights(
        double alignmentWeight,
        double characterOverlapWeight,
        double lengthWeight
) {
    public SimilarityWeights {
        if (alignmentWeight < 0 || characterOverlapWeight < 0 || lengthWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = alignmentWeight + characterOverlapWeight + lengthWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights: alignment dominant, then character overlap, then length.
     */
    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.60, 0.25, 0.15);
    }
}
