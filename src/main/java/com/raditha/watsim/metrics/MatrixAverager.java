package com.raditha.watsim.metrics;

import com.raditha.watsim.model.SimilarityMatrix;

import java.util.List;

/**
 * Element-wise mean of matrices over the same labels, used to summarise the
 * trials of a random trimming run.
 */
public class MatrixAverager {

    /**
     * @throws IllegalArgumentException if the list is empty or the matrices differ in shape
     */
    public SimilarityMatrix average(List<SimilarityMatrix> matrices) {
        if (matrices == null || matrices.isEmpty()) {
            throw new IllegalArgumentException("No matrices to average");
        }
        SimilarityMatrix first = matrices.get(0);
        int n = first.size();
        double[][] sum = new double[n][n];
        for (SimilarityMatrix m : matrices) {
            first.requireSameShape(m);
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    sum[i][j] += m.get(i, j);
                }
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                sum[i][j] /= matrices.size();
            }
        }
        return new SimilarityMatrix(first.labels(), sum);
    }
}
