package com.raditha.watsim.similarity;

import com.raditha.watsim.model.InstructionProfile;

/**
 * Scores one pair of corpus items. This is the capability every metric
 * exposes to the matrix builder.
 */
@FunctionalInterface
public interface PairwiseScorer {

    double score(InstructionProfile first, InstructionProfile second);
}
