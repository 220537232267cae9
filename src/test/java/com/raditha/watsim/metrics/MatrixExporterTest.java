package com.raditha.watsim.metrics;

import com.raditha.watsim.model.CorpusLabel;
import com.raditha.watsim.model.SimilarityMatrix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MatrixExporter and MatrixCsvReader - CSV and JSON export.
 */
class MatrixExporterTest {

    @TempDir
    Path tempDir;

    private MatrixExporter exporter;
    private SimilarityMatrix matrix;

    @BeforeEach
    void setUp() {
        exporter = new MatrixExporter();
        matrix = new SimilarityMatrix(
                List.of(CorpusLabel.parse("bubsort_go"), CorpusLabel.parse("collatz_go")),
                new double[][]{{1.0, 0.125}, {0.125, 1.0}});
    }

    @Test
    void testCsvLayout() throws IOException {
        Path csv = tempDir.resolve("out/cosine_similarity_matrix.csv");

        exporter.exportToCsv(matrix, csv);

        assertEquals(List.of(
                ",bubsort_go,collatz_go",
                "bubsort_go,1.0,0.125",
                "collatz_go,0.125,1.0"), Files.readAllLines(csv));
    }

    @Test
    void testCsvReadBack() throws IOException {
        Path csv = tempDir.resolve("m.csv");
        exporter.exportToCsv(matrix, csv);

        assertEquals(matrix, new MatrixCsvReader().read(csv));
    }

    @Test
    void testCsvReaderRejectsBadFiles() throws IOException {
        MatrixCsvReader reader = new MatrixCsvReader();
        Path notSquare = tempDir.resolve("a.csv");
        Files.writeString(notSquare, ",bubsort_go,collatz_go\nbubsort_go,1.0,0.5\n");
        Path mislabelled = tempDir.resolve("b.csv");
        Files.writeString(mislabelled, ",bubsort_go\ncollatz_go,1.0\n");
        Path badValue = tempDir.resolve("c.csv");
        Files.writeString(badValue, ",bubsort_go\nbubsort_go,high\n");

        assertThrows(IllegalArgumentException.class, () -> reader.read(notSquare));
        assertThrows(IllegalArgumentException.class, () -> reader.read(mislabelled));
        assertThrows(IllegalArgumentException.class, () -> reader.read(badValue));
        assertThrows(IllegalArgumentException.class, () -> reader.read(tempDir.resolve("missing.csv")));
    }

    @Test
    void testCsvReaderNaNCells() throws IOException {
        Path csv = tempDir.resolve("nan.csv");
        Files.writeString(csv, ",bubsort_go,collatz_go\nbubsort_go,1.0,\ncollatz_go,NaN,1.0\n");

        SimilarityMatrix read = new MatrixCsvReader().read(csv);

        assertTrue(Double.isNaN(read.get(0, 1)));
        assertTrue(Double.isNaN(read.get(1, 0)));
    }

    @Test
    void testJsonExport() throws IOException {
        Path json = tempDir.resolve("kl_similarity_matrix.json");

        exporter.exportToJson(matrix, "kl", json);

        String content = Files.readString(json);
        assertTrue(content.contains("\"metric\" : \"kl\""));
        assertTrue(content.contains("\"timestamp\" : \""), "Timestamp should be ISO text, not an array");

        MatrixExporter.MatrixDocument doc = exporter.readJson(json);
        assertEquals("kl", doc.metric());
        assertEquals(List.of("bubsort_go", "collatz_go"), doc.labels());
        assertArrayEquals(new double[]{1.0, 0.125}, doc.values()[0]);
        assertNotNull(doc.timestamp());
    }
}
