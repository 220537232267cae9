package com.raditha.watsim.ngram;

import com.raditha.watsim.model.NGramTable;
import com.raditha.watsim.model.TokenSequence;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counts contiguous token windows (stride 1) of a token sequence.
 */
public class NGramTableBuilder {

    public static final int DEFAULT_MIN_N = 1;
    public static final int DEFAULT_MAX_N = 6;

    /**
     * Build the table for one window width.
     *
     * @param sequence Token sequence
     * @param n        Window width, at least 1
     * @return table of window counts; empty when n exceeds the sequence length
     */
    public NGramTable build(TokenSequence sequence, int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1, got " + n);
        }
        List<String> tokens = sequence.tokens();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (int i = 0; i <= tokens.size() - n; i++) {
            String key = String.join(NGramTable.DELIMITER, tokens.subList(i, i + n));
            counts.merge(key, 1, Integer::sum);
        }
        return new NGramTable(n, counts);
    }

    /**
     * Build tables for every n in [minN, maxN].
     */
    public Map<Integer, NGramTable> buildRange(TokenSequence sequence, int minN, int maxN) {
        if (minN < 1 || maxN < minN) {
            throw new IllegalArgumentException(
                    String.format("Invalid n-gram range [%d, %d]", minN, maxN));
        }
        Map<Integer, NGramTable> tables = new TreeMap<>();
        for (int n = minN; n <= maxN; n++) {
            tables.put(n, build(sequence, n));
        }
        return tables;
    }
}
