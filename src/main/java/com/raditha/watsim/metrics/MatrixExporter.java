package com.raditha.watsim.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.watsim.model.CorpusLabel;
import com.raditha.watsim.model.SimilarityMatrix;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Exports similarity matrices to CSV (index-column layout, one row per
 * label) and JSON.
 */
public class MatrixExporter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * JSON shape of an exported matrix.
     */
    public record MatrixDocument(
            String metric,
            LocalDateTime timestamp,
            List<String> labels,
            double[][] values) {
    }

    /**
     * Export to CSV. First row is an empty cell followed by the labels; every
     * following row is a label followed by its values.
     */
    public void exportToCsv(SimilarityMatrix matrix, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();
        List<CorpusLabel> labels = matrix.labels();

        for (CorpusLabel label : labels) {
            csv.append(',').append(label);
        }
        csv.append('\n');

        for (int i = 0; i < labels.size(); i++) {
            csv.append(labels.get(i));
            for (int j = 0; j < labels.size(); j++) {
                csv.append(',').append(matrix.get(i, j));
            }
            csv.append('\n');
        }

        createParent(outputPath);
        Files.writeString(outputPath, csv.toString(), StandardCharsets.UTF_8);
    }

    /**
     * Export to JSON with the metric name and an export timestamp.
     */
    public void exportToJson(SimilarityMatrix matrix, String metricName, Path outputPath) throws IOException {
        MatrixDocument document = new MatrixDocument(
                metricName,
                LocalDateTime.now(),
                matrix.labels().stream().map(CorpusLabel::toString).toList(),
                matrix.toArray());
        createParent(outputPath);
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), document);
    }

    /**
     * Read back a JSON export.
     */
    public MatrixDocument readJson(Path path) throws IOException {
        return mapper.readValue(path.toFile(), MatrixDocument.class);
    }

    private static void createParent(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
    }
}
