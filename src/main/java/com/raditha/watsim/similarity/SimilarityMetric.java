package com.raditha.watsim.similarity;

import com.raditha.watsim.config.WatSimConfig;

import java.util.Arrays;
import java.util.List;

/**
 * The closed set of supported measures.
 */
public enum SimilarityMetric {
    COSINE("cosine"),
    JACCARD("jaccard"),
    OVERLAP("overlap"),
    MANHATTAN("manhattan"),
    KL("kl"),
    LCS("lcs");

    private final String cliName;

    SimilarityMetric(String cliName) {
        this.cliName = cliName;
    }

    public String toCliString() {
        return cliName;
    }

    public boolean usesNGrams() {
        return this != LCS;
    }

    /**
     * Create the pair scorer for this metric. N-gram metrics average over the
     * configured n range; LCS uses the configured normalization.
     */
    public PairwiseScorer scorer(WatSimConfig config) {
        return switch (this) {
            case COSINE -> new NGramAveragingScorer(new CosineSimilarity(), config.minN(), config.maxN());
            case JACCARD -> new NGramAveragingScorer(new JaccardSimilarity(), config.minN(), config.maxN());
            case OVERLAP -> new NGramAveragingScorer(new OverlapSimilarity(), config.minN(), config.maxN());
            case MANHATTAN -> new NGramAveragingScorer(new ManhattanSimilarity(), config.minN(), config.maxN());
            case KL -> new NGramAveragingScorer(new KLSimilarity(), config.minN(), config.maxN());
            case LCS -> new LcsScorer(config.lcsNormalization(), config.lcsLimit());
        };
    }

    /**
     * Base name used for exported matrix files, e.g.
     * {@code cosine_similarity_matrix} or
     * {@code lcs_instruction_similarity_matrix_min}.
     */
    public String matrixFileStem(LcsNormalization normalization) {
        return matrixFileStem(normalization, null);
    }

    /**
     * As {@link #matrixFileStem(LcsNormalization)}, with {@code _limit<N>}
     * appended to the LCS stem when an instruction limit is set.
     */
    public String matrixFileStem(LcsNormalization normalization, Integer lcsLimit) {
        if (this == LCS) {
            String stem = "lcs_instruction_similarity_matrix_" + normalization.toCliString();
            return lcsLimit != null ? stem + "_limit" + lcsLimit : stem;
        }
        return cliName + "_similarity_matrix";
    }

    /**
     * @param value metric name (case-insensitive)
     * @throws IllegalArgumentException if the name is unknown
     */
    public static SimilarityMetric fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Metric cannot be null");
        }
        String v = value.trim().toLowerCase();
        for (SimilarityMetric metric : values()) {
            if (metric.cliName.equals(v)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown metric: " + value + ". Must be one of "
                + Arrays.stream(values()).map(SimilarityMetric::toCliString).toList());
    }

    /**
     * Parse a comma-separated list; {@code all} selects every metric.
     */
    public static List<SimilarityMetric> parseList(String value) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("all")) {
            return List.of(values());
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(SimilarityMetric::fromString)
                .distinct()
                .toList();
    }
}
