package com.mapsheet.collection.similarity;

import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard similarity over character sets.
 * Computes similarity as |intersection| / |union| of the distinct characters of each string.
 */
public class CharacterOverlapSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        Set<Integer> chars1 = characters(s1);
        Set<Integer> chars2 = characters(s2);

        if (chars1.isEmpty() || chars2.isEmpty()) {
            return 0.0;
        }

        int intersectionSize = 0;
        for (Integer ch : chars1) {
            if (chars2.contains(ch)) {
                intersectionSize++;
            }
        }

        // |union| = |A| + |B| - |intersection|
        int unionSize = chars1.size() + chars2.size() - intersectionSize;

        return (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return "CharacterOverlap";
    }

    private Set<Integer> characters(String s) {
        Set<Integer> set = new HashSet<>();
        s.codePoints().forEach(set::add);
        return set;
    }
}
