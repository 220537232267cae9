package com.raditha.watsim.similarity;

import com.raditha.watsim.model.InstructionProfile;
import com.raditha.watsim.trimming.Trimmer;

import java.util.List;

/**
 * LCS similarity over the instruction sequences. Computed once per pair,
 * not per n. With a limit only the first {@code limit} instructions of each
 * sequence are compared.
 */
public class LcsScorer implements PairwiseScorer {

    private final LCSSimilarity lcs;
    private final Integer limit;

    public LcsScorer(LcsNormalization normalization) {
        this(normalization, null);
    }

    public LcsScorer(LcsNormalization normalization, Integer limit) {
        this.lcs = new LCSSimilarity(normalization);
        this.limit = limit;
    }

    @Override
    public double score(InstructionProfile first, InstructionProfile second) {
        return lcs.calculate(limited(first.tokens().tokens()), limited(second.tokens().tokens()));
    }

    private List<String> limited(List<String> tokens) {
        if (limit == null) {
            return tokens;
        }
        return Trimmer.head(tokens, limit).elements();
    }
}
