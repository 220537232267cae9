package com.raditha.watsim.analyzer;

import com.raditha.watsim.config.WatSimConfig;
import com.raditha.watsim.corpus.CorpusLayout;
import com.raditha.watsim.corpus.CorpusReader;
import com.raditha.watsim.corpus.ProfileLoader;
import com.raditha.watsim.model.InstructionProfile;
import com.raditha.watsim.model.SimilarityMatrix;
import com.raditha.watsim.similarity.SimilarityMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Main orchestrator for a corpus: loads every target once, then builds one
 * matrix per requested metric.
 */
public class SimilarityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityAnalyzer.class);

    private final WatSimConfig config;
    private final boolean logProgress;

    /**
     * Create analyzer with default configuration.
     */
    public SimilarityAnalyzer() {
        this(WatSimConfig.defaults(), false);
    }

    public SimilarityAnalyzer(WatSimConfig config, boolean logProgress) {
        this.config = config;
        this.logProgress = logProgress;
    }

    /**
     * @param corpusRoot Root of the corpus tree
     * @param metrics    Metrics to build, in output order
     * @return one matrix per metric
     * @throws IllegalArgumentException if the corpus root is unusable
     */
    public Map<SimilarityMetric, SimilarityMatrix> analyze(Path corpusRoot, List<SimilarityMetric> metrics) {
        CorpusReader reader = new CorpusReader(new CorpusLayout(corpusRoot, config.gramFileSuffix()));
        List<InstructionProfile> profiles = new ProfileLoader(config, reader).loadTargets();
        logger.info("Loaded {} corpus items from {}", profiles.size(), corpusRoot);
        return analyze(profiles, metrics);
    }

    /**
     * Build matrices over profiles already in memory.
     */
    public Map<SimilarityMetric, SimilarityMatrix> analyze(List<InstructionProfile> profiles,
                                                           List<SimilarityMetric> metrics) {
        Map<SimilarityMetric, SimilarityMatrix> result = new LinkedHashMap<>();
        for (SimilarityMetric metric : metrics) {
            PairwiseMatrixBuilder builder = new PairwiseMatrixBuilder();
            ProgressLogger progress = new ProgressLogger(metric.toCliString());
            if (logProgress) {
                builder.addListener(progress);
            }
            result.put(metric, builder.build(profiles, metric.scorer(config)));
            if (logProgress) {
                logger.info("[{}] matrix complete in {}s", metric.toCliString(),
                        String.format("%.2f", progress.elapsedSeconds()));
            }
        }
        return result;
    }
}
