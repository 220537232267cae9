package com.raditha.watsim.trimming;

import java.util.List;

/**
 * Result of trimming one sequence, with what is needed to reproduce it.
 *
 * @param elements       Retained elements, in original order
 * @param strategy       Strategy used
 * @param targetLength   Requested length
 * @param originalLength Length before trimming
 * @param startOffset    0-based index of the first retained element
 * @param trial          Trial number for random trims, 0 otherwise
 * @param seed           Seed of the generator that chose the offset; null for deterministic trims
 * @param <T>            Element type (lines or tokens)
 */
public record TrimmedVariant<T>(
        List<T> elements,
        TrimStrategy strategy,
        int targetLength,
        int originalLength,
        int startOffset,
        int trial,
        Long seed) {

    public TrimmedVariant {
        elements = List.copyOf(elements);
    }

    public int keptLength() {
        return elements.size();
    }

    /**
     * Same result tagged with a trial number and the trial seed.
     */
    public TrimmedVariant<T> forTrial(int trialNumber, long trialSeed) {
        return new TrimmedVariant<>(elements, strategy, targetLength, originalLength, startOffset,
                trialNumber, trialSeed);
    }
}
