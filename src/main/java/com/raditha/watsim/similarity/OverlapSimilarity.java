package com.raditha.watsim.similarity;

import com.raditha.watsim.model.NGramTable;

/**
 * Overlap (Szymkiewicz-Simpson) coefficient of the two n-gram key sets,
 * |A ∩ B| / min(|A|, |B|).
 */
public class OverlapSimilarity implements NGramSimilarity {

    @Override
    public double calculate(NGramTable table1, NGramTable table2) {
        if (table1 == null || table2 == null || table1.isEmpty() || table2.isEmpty()) {
            return 0.0;
        }
        int intersection = JaccardSimilarity.intersectionSize(table1.keys(), table2.keys());
        int minSize = Math.min(table1.size(), table2.size());
        return (double) intersection / minSize;
    }
}
