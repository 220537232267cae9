package com.raditha.watsim.ngram;

import com.raditha.watsim.model.NGramTable;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the tab-separated gram file format:
 * one {@code <ngram-key>\t<count>} line per distinct window.
 */
public class NGramTableIO {

    private static final char SEPARATOR = '\t';

    /**
     * Parse a gram file. Lines without exactly two fields or with a
     * non-integer or non-positive count are skipped. Repeated keys are summed.
     */
    public NGramTable read(Path file, int n) throws IOException {
        Map<String, Integer> counts = new LinkedHashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                parseLine(line, counts);
            }
        }
        return new NGramTable(n, counts);
    }

    /**
     * Parse gram lines already in memory.
     */
    public NGramTable parse(List<String> lines, int n) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String line : lines) {
            parseLine(line, counts);
        }
        return new NGramTable(n, counts);
    }

    private static void parseLine(String line, Map<String, Integer> counts) {
        String[] parts = line.strip().split("\t", -1);
        if (parts.length != 2) {
            return;
        }
        int count;
        try {
            count = Integer.parseInt(parts[1].strip());
        } catch (NumberFormatException e) {
            return;
        }
        if (count <= 0) {
            return;
        }
        Integer previous = counts.get(parts[0]);
        if (previous != null) {
            try {
                count = Math.addExact(previous, count);
            } catch (ArithmeticException e) {
                // Summed count does not fit; keep what was read so far
                return;
            }
        }
        counts.put(parts[0], count);
    }

    /**
     * Write a table most frequent first; ties keep first-seen order.
     * Parent directories are created.
     */
    public void write(NGramTable table, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(table.asMap().entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (Map.Entry<String, Integer> e : entries) {
                writer.write(e.getKey());
                writer.write(SEPARATOR);
                writer.write(Integer.toString(e.getValue()));
                writer.write('\n');
            }
        }
    }
}
