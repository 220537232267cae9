package com.raditha.watsim.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Square matrix of pairwise scores over an ordered list of corpus labels.
 * Row and column order equal the label order.
 */
public final class SimilarityMatrix {

    private final List<CorpusLabel> labels;
    private final double[][] values;

    /**
     * @param labels Row/column labels in order
     * @param values N x N values; copied
     */
    public SimilarityMatrix(List<CorpusLabel> labels, double[][] values) {
        if (labels == null || values == null) {
            throw new IllegalArgumentException("labels and values cannot be null");
        }
        int n = labels.size();
        if (values.length != n) {
            throw new IllegalArgumentException(
                    String.format("Matrix has %d rows but %d labels", values.length, n));
        }
        this.labels = List.copyOf(labels);
        this.values = new double[n][];
        for (int i = 0; i < n; i++) {
            if (values[i].length != n) {
                throw new IllegalArgumentException(
                        String.format("Row %d has %d columns, expected %d", i, values[i].length, n));
            }
            this.values[i] = values[i].clone();
        }
    }

    public List<CorpusLabel> labels() {
        return labels;
    }

    public int size() {
        return labels.size();
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    public double get(CorpusLabel row, CorpusLabel column) {
        return values[indexOf(row)][indexOf(column)];
    }

    public int indexOf(CorpusLabel label) {
        int idx = labels.indexOf(label);
        if (idx < 0) {
            throw new IllegalArgumentException("Label not in matrix: " + label);
        }
        return idx;
    }

    /**
     * Copy of the values.
     */
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    /**
     * Values strictly above the diagonal, row by row.
     */
    public double[] upperTriangle() {
        int n = size();
        double[] out = new double[n * (n - 1) / 2];
        int k = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                out[k++] = values[i][j];
            }
        }
        return out;
    }

    public boolean isSymmetric() {
        for (int i = 0; i < values.length; i++) {
            for (int j = i + 1; j < values.length; j++) {
                if (Double.compare(values[i][j], values[j][i]) != 0) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Fail if the other matrix does not cover the same labels in the same
     * order.
     *
     * @throws IllegalArgumentException on any size or label difference
     */
    public void requireSameShape(SimilarityMatrix other) {
        if (other.size() != size()) {
            throw new IllegalArgumentException(
                    String.format("Matrix size mismatch: %d vs %d", size(), other.size()));
        }
        if (!other.labels.equals(labels)) {
            List<String> mine = new ArrayList<>();
            List<String> theirs = new ArrayList<>();
            labels.forEach(l -> mine.add(l.toString()));
            other.labels.forEach(l -> theirs.add(l.toString()));
            throw new IllegalArgumentException("Matrix label mismatch: " + mine + " vs " + theirs);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SimilarityMatrix other)) {
            return false;
        }
        return labels.equals(other.labels) && Arrays.deepEquals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * labels.hashCode() + Arrays.deepHashCode(values);
    }
}
