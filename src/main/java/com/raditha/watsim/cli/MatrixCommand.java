package com.raditha.watsim.cli;

import com.raditha.watsim.analyzer.SimilarityAnalyzer;
import com.raditha.watsim.config.WatSimConfig;
import com.raditha.watsim.config.WatSimSettings;
import com.raditha.watsim.metrics.MatrixExporter;
import com.raditha.watsim.model.SimilarityMatrix;
import com.raditha.watsim.similarity.SimilarityMetric;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Builds one similarity matrix per metric over the configured targets.
 */
@Command(name = "matrix", mixinStandardHelpOptions = true,
        description = "Build pairwise similarity matrices for a corpus")
@SuppressWarnings("java:S106")
public class MatrixCommand implements Callable<Integer> {

    @Option(names = "--config-file", description = "YAML configuration file", paramLabel = "<path>")
    Path configFile;

    @Option(names = "--base-dir", required = true, description = "Corpus root (<algo>/<lang>/<algo>.wat)", paramLabel = "<path>")
    Path baseDir;

    @Option(names = "--output-dir", description = "Directory for matrix files (default: ${DEFAULT-VALUE})", paramLabel = "<path>")
    Path outputDir = Path.of("similarity_matrices");

    @Option(names = "--metric", description = "Comma-separated metrics or 'all' (default: ${DEFAULT-VALUE})", paramLabel = "<names>")
    String metrics = "all";

    @Option(names = "--lcs-method", description = "LCS normalization: min, avg or max", paramLabel = "<method>")
    String lcsMethod;

    @Option(names = "--min-n", description = "Smallest n-gram width (default: 1)", paramLabel = "<n>")
    Integer minN;

    @Option(names = "--max-n", description = "Largest n-gram width (default: 6)", paramLabel = "<n>")
    Integer maxN;

    @Option(names = "--limit", description = "Compare only the first N instructions of each sequence in LCS", paramLabel = "<n>")
    Integer lcsLimit;

    @Option(names = "--targets", description = "Comma-separated <algo>_<lang> labels in matrix order", paramLabel = "<labels>")
    String targets;

    @Option(names = "--source", description = "Where n-grams come from: wat or grams", paramLabel = "<source>")
    String source;

    @Option(names = "--export", description = "Output format: csv, json or both (default: ${DEFAULT-VALUE})", paramLabel = "<format>")
    String exportFormat = "csv";

    @Option(names = "--quiet", description = "Do not log per-pair progress")
    boolean quiet;

    @Override
    public Integer call() throws Exception {
        String format = CliSupport.validateExportFormat(exportFormat);
        WatSimConfig config = WatSimSettings.loadConfig(
                WatSimSettings.readYaml(configFile), minN, maxN, lcsMethod, targets, source, lcsLimit);
        List<SimilarityMetric> selected = SimilarityMetric.parseList(metrics);

        System.out.println("=".repeat(80));
        System.out.println("WAT SIMILARITY MATRICES");
        System.out.println("=".repeat(80));
        System.out.printf("Corpus:   %s%n", baseDir);
        System.out.printf("Targets:  %d (%d pairs per metric)%n",
                config.targets().size(), config.targets().size() * (config.targets().size() - 1) / 2);
        System.out.printf("N-grams:  %d..%d from %s%n", config.minN(), config.maxN(),
                config.ngramSource().name().toLowerCase());
        if (config.lcsLimit() != null) {
            System.out.printf("LCS limit: first %d instructions%n", config.lcsLimit());
        }
        System.out.println();

        Map<SimilarityMetric, SimilarityMatrix> matrices =
                new SimilarityAnalyzer(config, !quiet).analyze(baseDir, selected);

        MatrixExporter exporter = new MatrixExporter();
        for (Map.Entry<SimilarityMetric, SimilarityMatrix> e : matrices.entrySet()) {
            String stem = e.getKey().matrixFileStem(config.lcsNormalization(), config.lcsLimit());
            if (!format.equals("json")) {
                Path csv = outputDir.resolve(stem + ".csv");
                exporter.exportToCsv(e.getValue(), csv);
                System.out.println("[SAVED] " + csv);
            }
            if (!format.equals("csv")) {
                Path json = outputDir.resolve(stem + ".json");
                exporter.exportToJson(e.getValue(), e.getKey().toCliString(), json);
                System.out.println("[SAVED] " + json);
            }
        }
        return 0;
    }
}
