package com.raditha.watsim.similarity;

import java.util.List;

/**
 * Calculates similarity using Longest Common Subsequence (LCS) of two
 * instruction sequences.
 * Space-optimized dynamic programming implementation.
 */
public class LCSSimilarity {

    private final LcsNormalization normalization;

    public LCSSimilarity() {
        this(LcsNormalization.MIN);
    }

    public LCSSimilarity(LcsNormalization normalization) {
        if (normalization == null) {
            throw new IllegalArgumentException("normalization cannot be null");
        }
        this.normalization = normalization;
    }

    public LcsNormalization normalization() {
        return normalization;
    }

    /**
     * Calculate LCS-based similarity between two token sequences.
     *
     * @param tokens1 First token sequence
     * @param tokens2 Second token sequence
     * @return Similarity score (0.0 to 1.0); 0.0 if either is empty
     */
    public double calculate(List<String> tokens1, List<String> tokens2) {
        if (tokens1 == null || tokens2 == null || tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }
        int lcsLength = lcsLength(tokens1, tokens2);
        return normalization.normalize(lcsLength, tokens1.size(), tokens2.size());
    }

    /**
     * Compute LCS length using space-optimized DP.
     * Uses only O(min(m,n)) space instead of O(m*n).
     */
    public static int lcsLength(List<String> tokens1, List<String> tokens2) {
        // Shorter sequence is the inner dimension
        TokenPair pair = ensureShorterFirst(tokens1, tokens2);

        int m = pair.shorter().size();
        int n = pair.longer().size();
        if (m == 0) {
            return 0;
        }

        RollingArrays arrays = new RollingArrays(m);

        for (int j = 1; j <= n; j++) {
            String token = pair.longer().get(j - 1);
            for (int i = 1; i <= m; i++) {
                if (pair.shorter().get(i - 1).equals(token)) {
                    arrays.curr[i] = arrays.prev[i - 1] + 1;
                } else {
                    arrays.curr[i] = Math.max(arrays.curr[i - 1], arrays.prev[i]);
                }
            }
            arrays.swap();
        }

        return arrays.prev[m];
    }

    static TokenPair ensureShorterFirst(List<String> tokens1, List<String> tokens2) {
        if (tokens1.size() > tokens2.size()) {
            return new TokenPair(tokens2, tokens1);
        }
        return new TokenPair(tokens1, tokens2);
    }

    /**
     * Previous and current DP rows; column 0 stays 0 in both.
     */
    static class RollingArrays {
        int[] prev;
        int[] curr;

        RollingArrays(int size) {
            this.prev = new int[size + 1];
            this.curr = new int[size + 1];
        }

        void swap() {
            int[] temp = prev;
            prev = curr;
            curr = temp;
        }
    }

    record TokenPair(List<String> shorter, List<String> longer) {
    }
}
