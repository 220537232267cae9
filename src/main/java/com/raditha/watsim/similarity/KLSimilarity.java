package com.raditha.watsim.similarity;

import com.raditha.watsim.model.NGramTable;

import java.util.HashSet;
import java.util.Set;

/**
 * Similarity from the symmetrised Kullback-Leibler divergence of the two
 * n-gram distributions: {@code 1 / (1 + KL(P||Q) + KL(Q||P))}.
 * Every probability is smoothed by {@link #EPSILON} before taking logs so
 * keys missing on one side stay finite.
 */
public class KLSimilarity implements NGramSimilarity {

    static final double EPSILON = 1e-10;

    @Override
    public double calculate(NGramTable table1, NGramTable table2) {
        if (table1 == null || table2 == null
                || table1.isEmpty() || table2.isEmpty()
                || table1.total() == 0 || table2.total() == 0) {
            return 0.0;
        }
        Set<String> keys = new HashSet<>(table1.keys());
        keys.addAll(table2.keys());
        double d = divergence(table1, table2, keys) + divergence(table2, table1, keys);
        return 1.0 / (1.0 + d);
    }

    /**
     * KL(P || Q) over the given key universe.
     */
    double divergence(NGramTable p, NGramTable q, Set<String> keys) {
        double totalP = p.total();
        double totalQ = q.total();
        double kl = 0.0;
        for (String key : keys) {
            double pk = p.count(key) / totalP + EPSILON;
            double qk = q.count(key) / totalQ + EPSILON;
            kl += pk * Math.log(pk / qk);
        }
        return kl;
    }
}
