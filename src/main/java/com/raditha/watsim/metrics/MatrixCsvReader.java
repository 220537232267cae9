package com.raditha.watsim.metrics;

import com.raditha.watsim.model.CorpusLabel;
import com.raditha.watsim.model.SimilarityMatrix;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads matrices written by {@link MatrixExporter#exportToCsv}.
 */
public class MatrixCsvReader {

    /**
     * @throws IllegalArgumentException if the file is missing or not a square labelled matrix
     */
    public SimilarityMatrix read(Path csvPath) throws IOException {
        if (!Files.isRegularFile(csvPath)) {
            throw new IllegalArgumentException("Matrix CSV not found: " + csvPath);
        }
        List<String> lines = Files.readAllLines(csvPath, StandardCharsets.UTF_8).stream()
                .filter(l -> !l.isBlank())
                .toList();
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("Matrix CSV is empty: " + csvPath);
        }

        String[] header = lines.get(0).split(",", -1);
        List<CorpusLabel> labels = new ArrayList<>();
        for (int k = 1; k < header.length; k++) {
            labels.add(CorpusLabel.parse(header[k].trim()));
        }

        int n = labels.size();
        if (lines.size() - 1 != n) {
            throw new IllegalArgumentException(
                    String.format("%s: %d columns but %d rows", csvPath, n, lines.size() - 1));
        }

        double[][] values = new double[n][n];
        for (int i = 0; i < n; i++) {
            String[] cells = lines.get(i + 1).split(",", -1);
            if (cells.length != n + 1) {
                throw new IllegalArgumentException(
                        String.format("%s: row %d has %d cells, expected %d", csvPath, i + 1, cells.length, n + 1));
            }
            if (!CorpusLabel.parse(cells[0].trim()).equals(labels.get(i))) {
                throw new IllegalArgumentException(
                        String.format("%s: row label %s does not match column label %s", csvPath, cells[0], labels.get(i)));
            }
            for (int j = 0; j < n; j++) {
                values[i][j] = parseCell(cells[j + 1].trim());
            }
        }
        return new SimilarityMatrix(labels, values);
    }

    private static double parseCell(String cell) {
        if (cell.isEmpty() || cell.equalsIgnoreCase("nan")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid matrix value: " + cell, e);
        }
    }
}
