package com.raditha.watsim.similarity;

import com.raditha.watsim.config.WatSimConfig;
import com.raditha.watsim.model.CorpusLabel;
import com.raditha.watsim.model.InstructionProfile;
import com.raditha.watsim.model.TokenSequence;
import com.raditha.watsim.ngram.NGramTableBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityMetricTest {

    @Test
    void testParseList() {
        assertEquals(List.of(SimilarityMetric.values()), SimilarityMetric.parseList("all"));
        assertEquals(List.of(SimilarityMetric.values()), SimilarityMetric.parseList(null));
        assertEquals(List.of(SimilarityMetric.LCS, SimilarityMetric.COSINE),
                SimilarityMetric.parseList("lcs, Cosine,lcs"));
        assertThrows(IllegalArgumentException.class, () -> SimilarityMetric.parseList("cosine,euclid"));
    }

    @Test
    void testFileStems() {
        assertEquals("cosine_similarity_matrix", SimilarityMetric.COSINE.matrixFileStem(LcsNormalization.MIN));
        assertEquals("kl_similarity_matrix", SimilarityMetric.KL.matrixFileStem(LcsNormalization.MAX));
        assertEquals("lcs_instruction_similarity_matrix_avg",
                SimilarityMetric.LCS.matrixFileStem(LcsNormalization.AVG));
    }

    @Test
    void testLcsLimitInFileStem() {
        assertEquals("lcs_instruction_similarity_matrix_min_limit2000",
                SimilarityMetric.LCS.matrixFileStem(LcsNormalization.MIN, 2000));
        assertEquals("lcs_instruction_similarity_matrix_min",
                SimilarityMetric.LCS.matrixFileStem(LcsNormalization.MIN, null));
        assertEquals("cosine_similarity_matrix", SimilarityMetric.COSINE.matrixFileStem(LcsNormalization.MIN, 50));
    }

    @Test
    void testLcsLimitComparesPrefixOnly() {
        InstructionProfile a = profile("bubsort_c", List.of("x.a", "x.b", "x.c", "x.d"));
        InstructionProfile b = profile("bubsort_go", List.of("x.z", "x.b", "x.c", "x.d"));
        WatSimConfig config = WatSimConfig.defaults();

        assertEquals(0.75, SimilarityMetric.LCS.scorer(config).score(a, b), 1e-9);
        assertEquals(0.0, SimilarityMetric.LCS.scorer(config.withLcsLimit(1)).score(a, b));
        assertEquals(0.5, new LcsScorer(LcsNormalization.MIN, 2).score(a, b), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> config.withLcsLimit(0));
    }

    @Test
    void testScorerTypes() {
        WatSimConfig config = WatSimConfig.defaults();

        assertInstanceOf(LcsScorer.class, SimilarityMetric.LCS.scorer(config));
        assertInstanceOf(NGramAveragingScorer.class, SimilarityMetric.JACCARD.scorer(config));
        assertFalse(SimilarityMetric.LCS.usesNGrams());
        assertTrue(SimilarityMetric.KL.usesNGrams());
    }

    @Test
    void testAveragingOverRange() {
        // Same unigrams, no shared bigrams or trigrams
        InstructionProfile a = profile("bubsort_c", List.of("x.a", "x.b"));
        InstructionProfile b = profile("bubsort_go", List.of("x.b", "x.a"));

        double score = new NGramAveragingScorer(new JaccardSimilarity(), 1, 3).score(a, b);

        // n=1 -> 1.0, n=2 -> 0.0, n=3 -> both empty -> 0.0
        assertEquals(1.0 / 3.0, score, 1e-9);
    }

    @Test
    void testInvalidRange() {
        assertThrows(IllegalArgumentException.class,
                () -> new NGramAveragingScorer(new CosineSimilarity(), 0, 2));
        assertThrows(IllegalArgumentException.class,
                () -> new NGramAveragingScorer(new CosineSimilarity(), 4, 2));
    }

    private static InstructionProfile profile(String label, List<String> tokens) {
        TokenSequence seq = new TokenSequence(tokens);
        return new InstructionProfile(CorpusLabel.parse(label), seq, new NGramTableBuilder().buildRange(seq, 1, 3));
    }
}
