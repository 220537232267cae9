package com.raditha.watsim.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityMatrixTest {

    private static final List<CorpusLabel> LABELS = List.of(
            CorpusLabel.parse("bubsort_c"),
            CorpusLabel.parse("bubsort_go"),
            CorpusLabel.parse("collatz_go"));

    private static SimilarityMatrix sample() {
        return new SimilarityMatrix(LABELS, new double[][]{
                {1.0, 0.2, 0.3},
                {0.2, 1.0, 0.4},
                {0.3, 0.4, 1.0}});
    }

    @Test
    void testLookupByLabel() {
        SimilarityMatrix matrix = sample();

        assertEquals(0.4, matrix.get(CorpusLabel.parse("bubsort_go"), CorpusLabel.parse("collatz_go")));
        assertEquals(2, matrix.indexOf(CorpusLabel.parse("collatz_go")));
        assertThrows(IllegalArgumentException.class, () -> matrix.indexOf(CorpusLabel.parse("fizzbuzz_go")));
    }

    @Test
    void testUpperTriangleRowByRow() {
        assertArrayEquals(new double[]{0.2, 0.3, 0.4}, sample().upperTriangle());
    }

    @Test
    void testSymmetry() {
        assertTrue(sample().isSymmetric());

        SimilarityMatrix skewed = new SimilarityMatrix(LABELS.subList(0, 2), new double[][]{
                {1.0, 0.2},
                {0.5, 1.0}});
        assertFalse(skewed.isSymmetric());
    }

    @Test
    void testValuesAreCopied() {
        double[][] values = {{1.0, 0.5}, {0.5, 1.0}};
        SimilarityMatrix matrix = new SimilarityMatrix(LABELS.subList(0, 2), values);
        values[0][1] = 0.0;

        assertEquals(0.5, matrix.get(0, 1));
        matrix.toArray()[0][1] = 0.0;
        assertEquals(0.5, matrix.get(0, 1));
    }

    @Test
    void testRejectsNonSquare() {
        assertThrows(IllegalArgumentException.class,
                () -> new SimilarityMatrix(LABELS, new double[][]{{1.0, 0.0, 0.0}}));
        assertThrows(IllegalArgumentException.class,
                () -> new SimilarityMatrix(LABELS.subList(0, 2), new double[][]{{1.0}, {0.0, 1.0}}));
    }

    @Test
    void testRequireSameShape() {
        SimilarityMatrix matrix = sample();
        matrix.requireSameShape(sample());

        SimilarityMatrix smaller = new SimilarityMatrix(LABELS.subList(0, 2), new double[][]{{1, 0}, {0, 1}});
        assertThrows(IllegalArgumentException.class, () -> matrix.requireSameShape(smaller));

        SimilarityMatrix reordered = new SimilarityMatrix(
                List.of(LABELS.get(1), LABELS.get(0), LABELS.get(2)), sample().toArray());
        assertThrows(IllegalArgumentException.class, () -> matrix.requireSameShape(reordered));
    }
}
