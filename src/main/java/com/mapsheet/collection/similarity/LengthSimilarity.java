package com.mapsheet.collection.similarity;

/**
 * Length-difference penalty expressed as a similarity.
 * Computes {@code 1 - |len(s1) - len(s2)| / max(len(s1), len(s2))}.
 */
public class LengthSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.isEmpty() && s2.isEmpty()) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        int maxLength = Math.max(s1.length(), s2.length());
        int difference = Math.abs(s1.length() - s2.length());
        return 1.0 - ((double) difference / maxLength);
    }

    @Override
    public String getName() {
        return "Length";
    }
}
