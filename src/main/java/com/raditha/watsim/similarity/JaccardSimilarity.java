package com.raditha.watsim.similarity;

import com.raditha.watsim.model.NGramTable;

import java.util.Set;

/**
 * Jaccard index of the two n-gram key sets, |A ∩ B| / |A ∪ B|.
 * Counts are ignored.
 */
public class JaccardSimilarity implements NGramSimilarity {

    @Override
    public double calculate(NGramTable table1, NGramTable table2) {
        if (table1 == null || table2 == null) {
            return 0.0;
        }
        Set<String> a = table1.keys();
        Set<String> b = table2.keys();
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        int intersection = intersectionSize(a, b);
        int union = a.size() + b.size() - intersection;
        return union > 0 ? (double) intersection / union : 0.0;
    }

    static int intersectionSize(Set<String> a, Set<String> b) {
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int count = 0;
        for (String key : smaller) {
            if (larger.contains(key)) {
                count++;
            }
        }
        return count;
    }
}
