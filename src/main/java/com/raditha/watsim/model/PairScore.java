package com.raditha.watsim.model;

/**
 * Notification emitted after one unordered pair of a matrix has been scored.
 *
 * @param row          Row index (always less than column)
 * @param column       Column index
 * @param first        Label at row
 * @param second       Label at column
 * @param score        Computed score (0.0 when scoring failed)
 * @param pairNumber   1-based position of this pair in the build
 * @param totalPairs   Number of pairs in the build, N(N-1)/2
 * @param elapsedNanos Time spent scoring this pair
 */
public record PairScore(
        int row,
        int column,
        CorpusLabel first,
        CorpusLabel second,
        double score,
        int pairNumber,
        int totalPairs,
        long elapsedNanos) {
}
