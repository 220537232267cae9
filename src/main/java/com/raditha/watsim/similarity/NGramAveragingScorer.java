package com.raditha.watsim.similarity;

import com.raditha.watsim.model.InstructionProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies an n-gram measure once per n in a range and returns the
 * arithmetic mean of the per-n scores.
 */
public class NGramAveragingScorer implements PairwiseScorer {

    private static final Logger logger = LoggerFactory.getLogger(NGramAveragingScorer.class);

    private final NGramSimilarity similarity;
    private final int minN;
    private final int maxN;

    public NGramAveragingScorer(NGramSimilarity similarity, int minN, int maxN) {
        if (similarity == null) {
            throw new IllegalArgumentException("similarity cannot be null");
        }
        if (minN < 1 || maxN < minN) {
            throw new IllegalArgumentException(
                    String.format("Invalid n-gram range [%d, %d]", minN, maxN));
        }
        this.similarity = similarity;
        this.minN = minN;
        this.maxN = maxN;
    }

    @Override
    public double score(InstructionProfile first, InstructionProfile second) {
        double sum = 0.0;
        for (int n = minN; n <= maxN; n++) {
            double sim = similarity.calculate(first.table(n), second.table(n));
            logger.debug("{} vs {}: n={} sim={}", first.label(), second.label(), n, sim);
            sum += sim;
        }
        return sum / (maxN - minN + 1);
    }
}
