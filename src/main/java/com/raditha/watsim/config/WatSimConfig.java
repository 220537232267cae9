package com.raditha.watsim.config;

import com.raditha.watsim.model.CorpusLabel;
import com.raditha.watsim.similarity.LcsNormalization;

import java.util.List;

/**
 * Configuration for building similarity matrices.
 *
 * @param minN             Smallest n-gram width averaged over
 * @param maxN             Largest n-gram width averaged over
 * @param lcsNormalization Denominator for the LCS score
 * @param targets          Corpus labels in matrix order
 * @param gramFileSuffix   Inserted between algorithm and {@code _<n>gram.txt} in gram file names
 * @param ngramSource      Where n-gram tables are read from
 * @param lcsLimit         Instructions of each sequence fed to LCS; null for the whole sequence
 */
public record WatSimConfig(
        int minN,
        int maxN,
        LcsNormalization lcsNormalization,
        List<CorpusLabel> targets,
        String gramFileSuffix,
        NGramSource ngramSource,
        Integer lcsLimit) {

    public static final List<CorpusLabel> REFERENCE_TARGETS = List.of(
            new CorpusLabel("bubsort", "go"), new CorpusLabel("collatz", "go"),
            new CorpusLabel("collatz", "js"), new CorpusLabel("bubsort", "js"),
            new CorpusLabel("helloworld", "go"), new CorpusLabel("fizzbuzz", "go"),
            new CorpusLabel("wordcount", "go"), new CorpusLabel("collatz", "rust"),
            new CorpusLabel("bubsort", "rust"), new CorpusLabel("wordcount", "c"),
            new CorpusLabel("fizzbuzz", "c"), new CorpusLabel("collatz", "c"),
            new CorpusLabel("bubsort", "c"), new CorpusLabel("bubsort", "ts"),
            new CorpusLabel("helloworld", "ts"));

    public static final String DEFAULT_GRAM_SUFFIX = "_bg";

    /**
     * Validate configuration.
     */
    public WatSimConfig {
        if (minN < 1) {
            throw new IllegalArgumentException("minN must be >= 1");
        }
        if (maxN < minN) {
            throw new IllegalArgumentException("maxN must be >= minN");
        }
        if (lcsNormalization == null) {
            throw new IllegalArgumentException("lcsNormalization cannot be null");
        }
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("targets cannot be empty");
        }
        if (targets.stream().distinct().count() != targets.size()) {
            throw new IllegalArgumentException("targets contain duplicate labels");
        }
        targets = List.copyOf(targets);
        if (gramFileSuffix == null) {
            gramFileSuffix = "";
        }
        if (ngramSource == null) {
            ngramSource = NGramSource.WAT;
        }
        if (lcsLimit != null && lcsLimit < 1) {
            throw new IllegalArgumentException("lcsLimit must be >= 1");
        }
    }

    public WatSimConfig(int minN, int maxN, LcsNormalization lcsNormalization, List<CorpusLabel> targets,
                        String gramFileSuffix, NGramSource ngramSource) {
        this(minN, maxN, lcsNormalization, targets, gramFileSuffix, ngramSource, null);
    }

    /**
     * Defaults: n in 1..6, LCS over min length, the 15 reference targets.
     */
    public static WatSimConfig defaults() {
        return new WatSimConfig(
                1,
                6,
                LcsNormalization.MIN,
                REFERENCE_TARGETS,
                DEFAULT_GRAM_SUFFIX,
                NGramSource.WAT);
    }

    public WatSimConfig withTargets(List<CorpusLabel> newTargets) {
        return new WatSimConfig(minN, maxN, lcsNormalization, newTargets, gramFileSuffix, ngramSource, lcsLimit);
    }

    public WatSimConfig withNGramSource(NGramSource source) {
        return new WatSimConfig(minN, maxN, lcsNormalization, targets, gramFileSuffix, source, lcsLimit);
    }

    public WatSimConfig withLcsNormalization(LcsNormalization normalization) {
        return new WatSimConfig(minN, maxN, normalization, targets, gramFileSuffix, ngramSource, lcsLimit);
    }

    public WatSimConfig withLcsLimit(Integer limit) {
        return new WatSimConfig(minN, maxN, lcsNormalization, targets, gramFileSuffix, ngramSource, limit);
    }
}
