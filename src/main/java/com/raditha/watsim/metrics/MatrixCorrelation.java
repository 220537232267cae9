package com.raditha.watsim.metrics;

import com.raditha.watsim.model.SimilarityMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pearson correlation between the off-diagonal upper triangles of two
 * matrices, e.g. before and after trimming.
 */
public class MatrixCorrelation {

    private static final Logger logger = LoggerFactory.getLogger(MatrixCorrelation.class);

    /**
     * @return r in [-1, 1], or NaN when fewer than two finite pairs remain or
     *         either side has zero variance
     * @throws IllegalArgumentException if the matrices differ in size or labels
     */
    public double pearson(SimilarityMatrix before, SimilarityMatrix after) {
        before.requireSameShape(after);
        return pearson(before.upperTriangle(), after.upperTriangle());
    }

    /**
     * Pearson r over paired values, ignoring pairs where either side is NaN.
     */
    public double pearson(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException(
                    String.format("Vector length mismatch: %d vs %d", x.length, y.length));
        }
        int count = 0;
        double sumX = 0.0;
        double sumY = 0.0;
        for (int k = 0; k < x.length; k++) {
            if (Double.isNaN(x[k]) || Double.isNaN(y[k])) {
                continue;
            }
            sumX += x[k];
            sumY += y[k];
            count++;
        }
        if (count < 2) {
            logger.warn("Fewer than two valid data points");
            return Double.NaN;
        }
        double meanX = sumX / count;
        double meanY = sumY / count;

        double cov = 0.0;
        double varX = 0.0;
        double varY = 0.0;
        for (int k = 0; k < x.length; k++) {
            if (Double.isNaN(x[k]) || Double.isNaN(y[k])) {
                continue;
            }
            double dx = x[k] - meanX;
            double dy = y[k] - meanY;
            cov += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0.0 || varY == 0.0) {
            logger.warn("Zero standard deviation (all values equal)");
            return Double.NaN;
        }
        return cov / Math.sqrt(varX * varY);
    }
}
