package com.raditha.watsim.metrics;

import com.raditha.watsim.model.CorpusLabel;
import com.raditha.watsim.model.SimilarityMatrix;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatrixAveragerTest {

    private static final List<CorpusLabel> LABELS =
            List.of(CorpusLabel.parse("bubsort_c"), CorpusLabel.parse("collatz_c"));

    private static SimilarityMatrix matrix(double offDiagonal) {
        return new SimilarityMatrix(LABELS, new double[][]{{1.0, offDiagonal}, {offDiagonal, 1.0}});
    }

    @Test
    void testElementWiseMean() {
        SimilarityMatrix avg = new MatrixAverager().average(List.of(matrix(0.2), matrix(0.4), matrix(0.9)));

        assertEquals(0.5, avg.get(0, 1), 1e-12);
        assertEquals(1.0, avg.get(1, 1), 1e-12);
        assertEquals(LABELS, avg.labels());
        assertTrue(avg.isSymmetric());
    }

    @Test
    void testSingleMatrixUnchanged() {
        assertEquals(matrix(0.3), new MatrixAverager().average(List.of(matrix(0.3))));
    }

    @Test
    void testRejectsEmptyAndMismatched() {
        MatrixAverager averager = new MatrixAverager();
        SimilarityMatrix other = new SimilarityMatrix(
                List.of(CorpusLabel.parse("bubsort_c"), CorpusLabel.parse("fizzbuzz_c")),
                new double[][]{{1.0, 0.0}, {0.0, 1.0}});

        assertThrows(IllegalArgumentException.class, () -> averager.average(List.of()));
        assertThrows(IllegalArgumentException.class, () -> averager.average(List.of(matrix(0.1), other)));
    }
}
