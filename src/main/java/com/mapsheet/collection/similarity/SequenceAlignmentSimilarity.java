package com.mapsheet.collection.similarity;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Longest-matching-block alignment ratio (Ratcliff/Obershelp).
 * Repeatedly takes the longest common block, then recurses into the unmatched pieces
 * on either side. Score is {@code 2 * M / (|s1| + |s2|)} where M is the number of
 * matched characters.
 */
public class SequenceAlignmentSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int total = s1.length() + s2.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(s1, s2) / total;
    }

    @Override
    public String getName() {
        return "SequenceAlignment";
    }

    /**
     * Counts characters covered by the recursive longest-block decomposition.
     */
    int matchingCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length(), 0, b.length()});

        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int alo = range[0];
            int ahi = range[1];
            int blo = range[2];
            int bhi = range[3];

            int[] block = longestBlock(a, alo, ahi, b, blo, bhi);
            int size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            int i = block[0];
            int j = block[1];
            if (alo < i && blo < j) {
                pending.push(new int[]{alo, i, blo, j});
            }
            if (i + size < ahi && j + size < bhi) {
                pending.push(new int[]{i + size, ahi, j + size, bhi});
            }
        }
        return matched;
    }

    /**
     * Finds the longest common block inside a[alo:ahi] and b[blo:bhi].
     * Ties go to the block starting earliest in a, then earliest in b.
     *
     * @return {start in a, start in b, length}
     */
    private int[] longestBlock(String a, int alo, int ahi, String b, int blo, int bhi) {
        int bestI = alo;
        int bestJ = blo;
        int bestSize = 0;

        // lengths[j + 1] = length of the common suffix ending at a[i - 1] and b[j]
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];

        for (int i = alo; i < ahi; i++) {
            char ch = a.charAt(i);
            for (int j = blo; j < bhi; j++) {
                if (ch == b.charAt(j)) {
                    int k = previous[j] + 1;
                    current[j + 1] = k;
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                } else {
                    current[j + 1] = 0;
                }
            }
            int[] temp = previous;
            previous = current;
            current = temp;
        }

        return new int[]{bestI, bestJ, bestSize};
    }
}
