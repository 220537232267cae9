package com.raditha.watsim.similarity;

import com.raditha.watsim.model.NGramTable;

/**
 * A similarity measure between two n-gram tables of the same n.
 * Implementations are stateless and return 0.0 when either side is empty.
 */
@FunctionalInterface
public interface NGramSimilarity {

    double calculate(NGramTable table1, NGramTable table2);
}
