package com.raditha.watsim.cli;

import com.raditha.watsim.metrics.MatrixCorrelation;
import com.raditha.watsim.metrics.MatrixCsvReader;
import com.raditha.watsim.similarity.LcsNormalization;
import com.raditha.watsim.similarity.SimilarityMetric;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Correlates matrices computed before and after trimming.
 */
@Command(name = "compare", mixinStandardHelpOptions = true,
        description = "Pearson correlation between before/after similarity matrices")
@SuppressWarnings("java:S106")
public class CompareCommand implements Callable<Integer> {

    @Option(names = "--before-dir", required = true, description = "Matrices of the untrimmed corpus", paramLabel = "<path>")
    Path beforeDir;

    @Option(names = "--after-dir", required = true, description = "Matrices of the trimmed corpus", paramLabel = "<path>")
    Path afterDir;

    @Option(names = "--after-suffix", description = "Suffix of the after files, e.g. _avg (default: none)", paramLabel = "<suffix>")
    String afterSuffix = "";

    @Option(names = "--metric", description = "Comma-separated metrics or 'all' (default: ${DEFAULT-VALUE})", paramLabel = "<names>")
    String metrics = "all";

    @Option(names = "--lcs-method", description = "LCS normalization in the file names (default: ${DEFAULT-VALUE})", paramLabel = "<method>")
    String lcsMethod = "min";

    @Option(names = "--limit", description = "LCS instruction limit in the file names", paramLabel = "<n>")
    Integer lcsLimit;

    @Override
    public Integer call() throws Exception {
        LcsNormalization normalization = LcsNormalization.fromString(lcsMethod);
        MatrixCsvReader reader = new MatrixCsvReader();
        MatrixCorrelation correlation = new MatrixCorrelation();

        System.out.printf("%-10s %s%n", "metric", "pearson_r");
        int compared = 0;
        for (SimilarityMetric metric : SimilarityMetric.parseList(metrics)) {
            String stem = metric.matrixFileStem(normalization, lcsLimit);
            Path before = beforeDir.resolve(stem + ".csv");
            Path after = afterDir.resolve(stem + afterSuffix + ".csv");
            if (!Files.isRegularFile(before) || !Files.isRegularFile(after)) {
                System.out.printf("%-10s missing%n", metric.toCliString());
                continue;
            }
            double r = correlation.pearson(reader.read(before), reader.read(after));
            System.out.printf("%-10s %s%n", metric.toCliString(), Double.isNaN(r) ? "NaN" : String.format("%.4f", r));
            compared++;
        }
        return compared > 0 ? 0 : 1;
    }
}
