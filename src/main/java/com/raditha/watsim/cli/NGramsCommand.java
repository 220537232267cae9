package com.raditha.watsim.cli;

import com.raditha.watsim.config.WatSimConfig;
import com.raditha.watsim.config.WatSimSettings;
import com.raditha.watsim.corpus.CorpusLayout;
import com.raditha.watsim.corpus.NGramExtractor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Writes gram files for every WAT file of a corpus.
 */
@Command(name = "ngrams", mixinStandardHelpOptions = true,
        description = "Extract instruction n-gram tables into grams/ directories")
@SuppressWarnings("java:S106")
public class NGramsCommand implements Callable<Integer> {

    @Option(names = "--config-file", description = "YAML configuration file", paramLabel = "<path>")
    Path configFile;

    @Option(names = "--base-dir", required = true, description = "Corpus root", paramLabel = "<path>")
    Path baseDir;

    @Option(names = "--min", description = "Smallest n (default: 1)", paramLabel = "<n>")
    Integer minN;

    @Option(names = "--max", description = "Largest n (default: 6)", paramLabel = "<n>")
    Integer maxN;

    @Option(names = "--algos", description = "Comma-separated algorithms", paramLabel = "<names>")
    String algos;

    @Option(names = "--langs", description = "Comma-separated languages", paramLabel = "<names>")
    String langs;

    @Override
    public Integer call() throws Exception {
        WatSimConfig config = WatSimSettings.loadConfig(
                WatSimSettings.readYaml(configFile), minN, maxN, null, null, null);
        CorpusLayout layout = new CorpusLayout(baseDir, config.gramFileSuffix());

        int processed = new NGramExtractor(config)
                .extractCorpus(layout, CliSupport.crossProduct(algos, langs));

        System.out.printf("Extracted %d-%d grams for %d WAT files under %s%n",
                config.minN(), config.maxN(), processed, baseDir);
        return 0;
    }
}
