package com.raditha.watsim.cli;

import com.raditha.watsim.config.TrimConfig;
import com.raditha.watsim.config.WatSimConfig;
import com.raditha.watsim.config.WatSimSettings;
import com.raditha.watsim.trimming.CorpusTrimmer;
import com.raditha.watsim.trimming.TrimReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Writes trimmed variants of a corpus.
 */
@Command(name = "trim", mixinStandardHelpOptions = true,
        description = "Trim WAT files by head, middle, tail or random window")
@SuppressWarnings("java:S106")
public class TrimCommand implements Callable<Integer> {

    @Option(names = "--config-file", description = "YAML configuration file", paramLabel = "<path>")
    Path configFile;

    @Option(names = "--input-base", required = true, description = "Untrimmed corpus root", paramLabel = "<path>")
    Path inputBase;

    @Option(names = "--output-base", required = true, description = "Output root for variant directories", paramLabel = "<path>")
    Path outputBase;

    @Option(names = "--method", description = "head, middle, tail or random (default: random)", paramLabel = "<method>")
    String method;

    @Option(names = "--lines", description = "Lines to keep (default: 500)", paramLabel = "<n>")
    Integer lines;

    @Option(names = "--trials", description = "Random trials (default: 10)", paramLabel = "<n>")
    Integer trials;

    @Option(names = "--seed", description = "Master seed for random trials", paramLabel = "<seed>")
    Long seed;

    @Option(names = "--algos", description = "Comma-separated algorithms", paramLabel = "<names>")
    String algos;

    @Option(names = "--langs", description = "Comma-separated languages", paramLabel = "<names>")
    String langs;

    @Override
    public Integer call() throws Exception {
        Map<String, Object> yaml = WatSimSettings.readYaml(configFile);
        WatSimConfig config = WatSimSettings.loadConfig(yaml, null, null, null, null, null);
        TrimConfig trimConfig = WatSimSettings.loadTrimConfig(yaml, method, lines, trials, seed, algos, langs);

        System.out.println("=".repeat(80));
        System.out.printf("WAT Trimming - %s%n", trimConfig.strategy().name());
        System.out.println("=".repeat(80));
        System.out.printf("Target lines:  %d%n", trimConfig.targetLength());
        System.out.printf("Input base:    %s%n", inputBase);
        System.out.printf("Output dir:    %s%n", outputBase);
        System.out.printf("Algorithms:    %s%n", String.join(", ", trimConfig.algorithms()));
        System.out.printf("Languages:     %s%n", String.join(", ", trimConfig.languages()));
        System.out.println();

        TrimReport report = new CorpusTrimmer(config).run(inputBase, outputBase, trimConfig);

        System.out.println("=".repeat(80));
        System.out.println("Summary");
        System.out.println("=".repeat(80));
        System.out.printf("Success:  %d%n", report.successCount());
        System.out.printf("Skipped:  %d%n", report.skipped());
        if (report.masterSeed() != null) {
            System.out.printf("Seed:     %d%n", report.masterSeed());
        }
        if (report.successCount() > 0) {
            System.out.println();
            System.out.printf("Average original lines: %.1f%n", report.averageOriginalLines());
            System.out.printf("Average trimmed lines:  %.1f%n", report.averageTrimmedLines());
            System.out.printf("Reduction rate:         %.1f%%%n", report.reductionRate());
            System.out.printf("Bytes before:           %d%n", report.originalBytes());
            System.out.printf("Bytes after:            %d%n", report.trimmedBytes());
            System.out.printf("Byte reduction rate:    %.1f%%%n", report.byteReductionRate());
        }
        return 0;
    }
}
