package com.raditha.watsim.similarity;

import com.raditha.watsim.model.NGramTable;

import java.util.Map;

/**
 * Cosine of the angle between two n-gram count vectors.
 */
public class CosineSimilarity implements NGramSimilarity {

    @Override
    public double calculate(NGramTable table1, NGramTable table2) {
        if (table1 == null || table2 == null || table1.isEmpty() || table2.isEmpty()) {
            return 0.0;
        }

        // Keys missing from one side contribute nothing to the dot product
        NGramTable smaller = table1.size() <= table2.size() ? table1 : table2;
        NGramTable larger = smaller == table1 ? table2 : table1;
        double dot = 0.0;
        for (Map.Entry<String, Integer> e : smaller.asMap().entrySet()) {
            dot += (double) e.getValue() * larger.count(e.getKey());
        }

        double norm1 = norm(table1);
        double norm2 = norm(table2);
        if (norm1 == 0.0 || norm2 == 0.0) {
            return 0.0;
        }
        // Rounding in the norms can push identical vectors just past 1
        return Math.min(1.0, dot / (norm1 * norm2));
    }

    private static double norm(NGramTable table) {
        double sum = 0.0;
        for (int v : table.asMap().values()) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }
}
