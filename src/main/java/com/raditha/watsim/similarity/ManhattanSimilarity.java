package com.raditha.watsim.similarity;

import com.raditha.watsim.model.NGramTable;

import java.util.HashSet;
import java.util.Set;

/**
 * Manhattan (L1) distance between two count vectors turned into a similarity:
 * {@code 1 - dist / (sum1 + sum2)}.
 */
public class ManhattanSimilarity implements NGramSimilarity {

    @Override
    public double calculate(NGramTable table1, NGramTable table2) {
        if (table1 == null || table2 == null || table1.isEmpty() || table2.isEmpty()) {
            return 0.0;
        }
        Set<String> keys = new HashSet<>(table1.keys());
        keys.addAll(table2.keys());

        long distance = 0;
        for (String key : keys) {
            distance += Math.abs((long) table1.count(key) - table2.count(key));
        }
        long total = table1.total() + table2.total();
        return total > 0 ? 1.0 - (double) distance / total : 0.0;
    }
}
