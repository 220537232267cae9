package com.raditha.watsim.model;

import java.util.Map;

/**
 * Everything the metric layer needs for one corpus item: its instruction
 * sequence (for LCS) and its n-gram tables keyed by n.
 *
 * @param label  Corpus label
 * @param tokens Instruction tokens
 * @param tables N-gram tables keyed by n
 */
public record InstructionProfile(CorpusLabel label, TokenSequence tokens, Map<Integer, NGramTable> tables) {

    public InstructionProfile {
        if (label == null) {
            throw new IllegalArgumentException("label cannot be null");
        }
        tokens = tokens == null ? TokenSequence.empty() : tokens;
        tables = tables == null ? Map.of() : Map.copyOf(tables);
    }

    /**
     * Table for the given n; an empty table if none was loaded.
     */
    public NGramTable table(int n) {
        NGramTable table = tables.get(n);
        return table != null ? table : NGramTable.empty(n);
    }
}
