package com.raditha.watsim.cli;

import com.raditha.watsim.metrics.MatrixAverager;
import com.raditha.watsim.metrics.MatrixCsvReader;
import com.raditha.watsim.metrics.MatrixExporter;
import com.raditha.watsim.model.SimilarityMatrix;
import com.raditha.watsim.similarity.LcsNormalization;
import com.raditha.watsim.similarity.SimilarityMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * Averages the matrices of random trimming trials.
 * Expects {@code <trials-dir>/<trial>/<stem>.csv} and writes
 * {@code <output-dir>/<stem>_avg.csv}.
 */
@Command(name = "average", mixinStandardHelpOptions = true,
        description = "Average per-trial similarity matrices element-wise")
@SuppressWarnings("java:S106")
public class AverageCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(AverageCommand.class);

    public static final String AVERAGE_SUFFIX = "_avg";

    @Option(names = "--trials-dir", required = true, description = "Directory holding one sub-directory per trial", paramLabel = "<path>")
    Path trialsDir;

    @Option(names = "--output-dir", required = true, description = "Directory for averaged matrices", paramLabel = "<path>")
    Path outputDir;

    @Option(names = "--metric", description = "Comma-separated metrics or 'all' (default: ${DEFAULT-VALUE})", paramLabel = "<names>")
    String metrics = "all";

    @Option(names = "--lcs-method", description = "LCS normalization in the file names (default: ${DEFAULT-VALUE})", paramLabel = "<method>")
    String lcsMethod = "min";

    @Option(names = "--limit", description = "LCS instruction limit in the file names", paramLabel = "<n>")
    Integer lcsLimit;

    @Override
    public Integer call() throws Exception {
        if (!Files.isDirectory(trialsDir)) {
            throw new IllegalArgumentException("Trials directory does not exist: " + trialsDir);
        }
        LcsNormalization normalization = LcsNormalization.fromString(lcsMethod);
        List<Path> trials = trialDirectories(trialsDir);
        System.out.printf("Found %d trial directories under %s%n", trials.size(), trialsDir);

        MatrixCsvReader reader = new MatrixCsvReader();
        MatrixAverager averager = new MatrixAverager();
        MatrixExporter exporter = new MatrixExporter();
        int written = 0;

        for (SimilarityMetric metric : SimilarityMetric.parseList(metrics)) {
            String stem = metric.matrixFileStem(normalization, lcsLimit);
            List<SimilarityMatrix> matrices = new ArrayList<>();
            for (Path trial : trials) {
                Path csv = trial.resolve(stem + ".csv");
                if (Files.isRegularFile(csv)) {
                    matrices.add(reader.read(csv));
                } else {
                    logger.warn("Missing {} in {}", csv.getFileName(), trial);
                }
            }
            if (matrices.isEmpty()) {
                System.out.printf("[SKIP] %s: no trial matrices found%n", metric.toCliString());
                continue;
            }

            Path out = outputDir.resolve(stem + AVERAGE_SUFFIX + ".csv");
            exporter.exportToCsv(averager.average(matrices), out);
            System.out.printf("[SAVED] %s (averaged %d trials)%n", out, matrices.size());
            written++;
        }
        return written > 0 ? 0 : 1;
    }

    static List<Path> trialDirectories(Path root) throws IOException {
        try (Stream<Path> children = Files.list(root)) {
            return children.filter(Files::isDirectory).sorted().toList();
        }
    }
}
