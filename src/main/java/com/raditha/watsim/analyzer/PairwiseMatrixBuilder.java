package com.raditha.watsim.analyzer;

import com.raditha.watsim.model.CorpusLabel;
import com.raditha.watsim.model.InstructionProfile;
import com.raditha.watsim.model.PairScore;
import com.raditha.watsim.model.SimilarityMatrix;
import com.raditha.watsim.similarity.PairwiseScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the symmetric all-pairs matrix for one scorer.
 *
 * The diagonal is 1.0. Each unordered pair (i &lt; j) is scored exactly once
 * and written to both (i, j) and (j, i), so N items cost N(N-1)/2 scorer
 * calls. Pairs are visited row by row in label order.
 */
public class PairwiseMatrixBuilder {

    private static final Logger logger = LoggerFactory.getLogger(PairwiseMatrixBuilder.class);

    private final List<PairScoreListener> listeners = new ArrayList<>();

    public PairwiseMatrixBuilder addListener(PairScoreListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
        return this;
    }

    /**
     * @param profiles Items in matrix order
     * @param scorer   Pair scorer
     * @return symmetric matrix labelled by the profiles' labels
     */
    public SimilarityMatrix build(List<InstructionProfile> profiles, PairwiseScorer scorer) {
        int n = profiles.size();
        List<CorpusLabel> labels = profiles.stream().map(InstructionProfile::label).toList();
        double[][] matrix = new double[n][n];

        int totalPairs = n * (n - 1) / 2;
        int done = 0;

        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i == j) {
                    matrix[i][j] = 1.0;
                } else if (i < j) {
                    long start = System.nanoTime();
                    double sim = scorePair(profiles.get(i), profiles.get(j), scorer);
                    long elapsed = System.nanoTime() - start;
                    matrix[i][j] = sim;
                    matrix[j][i] = sim;
                    done++;
                    notifyListeners(new PairScore(i, j, labels.get(i), labels.get(j), sim, done, totalPairs, elapsed));
                }
            }
        }

        return new SimilarityMatrix(labels, matrix);
    }

    private double scorePair(InstructionProfile first, InstructionProfile second, PairwiseScorer scorer) {
        try {
            return scorer.score(first, second);
        } catch (RuntimeException e) {
            logger.warn("Scoring {} vs {} failed, recording 0.0: {}", first.label(), second.label(), e.getMessage());
            return 0.0;
        }
    }

    private void notifyListeners(PairScore pairScore) {
        for (PairScoreListener listener : listeners) {
            listener.onPairScored(pairScore);
        }
    }
}
