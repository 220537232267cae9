package com.raditha.watsim.cli;

import com.raditha.watsim.config.TrimConfig;
import com.raditha.watsim.model.CorpusLabel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Option validation shared by the sub-commands.
 */
final class CliSupport {

    private CliSupport() {
    }

    /**
     * @return the lower-cased format
     * @throws IllegalArgumentException unless csv, json or both
     */
    static String validateExportFormat(String exportFormat) {
        String format = exportFormat == null ? "csv" : exportFormat.toLowerCase();
        if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
            throw new IllegalArgumentException(
                    "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
        }
        return format;
    }

    /**
     * Every algorithm/language combination, algorithms outermost.
     */
    static List<CorpusLabel> crossProduct(String algos, String langs) {
        List<String> algorithms = algos != null ? split(algos) : TrimConfig.DEFAULT_ALGORITHMS;
        List<String> languages = langs != null ? split(langs) : TrimConfig.DEFAULT_LANGUAGES;
        List<CorpusLabel> labels = new ArrayList<>();
        for (String a : algorithms) {
            for (String l : languages) {
                labels.add(new CorpusLabel(a, l));
            }
        }
        return labels;
    }

    private static List<String> split(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
