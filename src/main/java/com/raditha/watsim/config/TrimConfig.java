package com.raditha.watsim.config;

import com.raditha.watsim.trimming.TrimStrategy;

import java.util.List;

/**
 * Configuration for one trimming run over a corpus.
 *
 * @param strategy     Selection strategy
 * @param targetLength Lines to keep per file
 * @param trials       Number of random trials (ignored for deterministic strategies)
 * @param masterSeed   Seed the per-trial seeds derive from; null for a fresh seed
 * @param algorithms   Algorithms to include
 * @param languages    Languages to include
 * @param writeGrams   Also write gram files next to every trimmed WAT file
 */
public record TrimConfig(
        TrimStrategy strategy,
        int targetLength,
        int trials,
        Long masterSeed,
        List<String> algorithms,
        List<String> languages,
        boolean writeGrams) {

    public static final List<String> DEFAULT_ALGORITHMS =
            List.of("bubsort", "collatz", "fizzbuzz", "helloworld", "wordcount");
    public static final List<String> DEFAULT_LANGUAGES = List.of("c", "go", "js", "rust", "ts");

    public TrimConfig {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (targetLength < 0) {
            throw new IllegalArgumentException("targetLength must be >= 0");
        }
        if (trials < 1) {
            throw new IllegalArgumentException("trials must be >= 1");
        }
        algorithms = algorithms == null || algorithms.isEmpty() ? DEFAULT_ALGORITHMS : List.copyOf(algorithms);
        languages = languages == null || languages.isEmpty() ? DEFAULT_LANGUAGES : List.copyOf(languages);
    }

    /**
     * Random preset: ten trials.
     */
    public static TrimConfig random(int targetLength, Long masterSeed) {
        return new TrimConfig(TrimStrategy.RANDOM, targetLength, 10, masterSeed,
                DEFAULT_ALGORITHMS, DEFAULT_LANGUAGES, true);
    }

    /**
     * Number of variant directories this run produces.
     */
    public int variantCount() {
        return strategy == TrimStrategy.RANDOM ? trials : 1;
    }
}
