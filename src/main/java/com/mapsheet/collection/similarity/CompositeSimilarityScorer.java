package com.mapsheet.collection.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composite similarity scorer that combines three algorithms with configurable weights.
 * Formula: score = w1*alignment + w2*characterOverlap + w3*length
 */
public class CompositeSimilarityScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(CompositeSimilarityScorer.class);

    private final SequenceAlignmentSimilarity alignment;
    private final CharacterOverlapSimilarity characterOverlap;
    private final LengthSimilarity length;
    private final SimilarityWeights weights;

    public CompositeSimilarityScorer() {
        this(SimilarityWeights.defaultWeights());
    }

    public CompositeSimilarityScorer(SimilarityWeights weights) {
        this.alignment = new SequenceAlignmentSimilarity();
        this.characterOverlap = new CharacterOverlapSimilarity();
        this.length = new LengthSimilarity();
        this.weights = weights;
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

        double alignmentScore = alignment.compute(s1, s2);
        double overlapScore = characterOverlap.compute(s1, s2);
        double lengthScore = length.compute(s1, s2);

        double compositeScore = clamp(weights.alignmentWeight() * alignmentScore
                + weights.characterOverlapWeight() * overlapScore
                + weights.lengthWeight() * lengthScore);

        log.trace("Similarity scores for '{}' vs '{}': alignment={}, overlap={}, length={}, composite={}",
                s1, s2, alignmentScore, overlapScore, lengthScore, compositeScore);

        return compositeScore;
    }

    @Override
    public String getName() {
        return "Composite";
    }

    /**
     * Computes detailed similarity breakdown.
     */
    public SimilarityBreakdown computeWithBreakdown(String s1, String s2) {
        double alignmentScore = alignment.compute(s1, s2);
        double overlapScore = characterOverlap.compute(s1, s2);
        double lengthScore = length.compute(s1, s2);
        return new SimilarityBreakdown(alignmentScore, overlapScore, lengthScore, compute(s1, s2), weights);
    }

    /**
     * Gets the current weights configuration.
     */
    public SimilarityWeights getWeights() {
        return weights;
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * Detailed breakdown of similarity scores from each algorithm.
     */
    public record SimilarityBreakdown(
            double alignmentScore,
            double characterOverlapScore,
            double lengthScore,
            double compositeScore,
            SimilarityWeights weights
    ) {
        @Override
        public String toString() {
            return String.format(
                    "SimilarityBreakdown{alignment=%.4f (w=%.2f), overlap=%.4f (w=%.2f), length=%.4f (w=%.2f), composite=%.4f}",
                    alignmentScore, weights.alignmentWeight(),
                    characterOverlapScore, weights.characterOverlapWeight(),
                    lengthScore, weights.lengthWeight(),
                    compositeScore
            );
        }
    }
}
