package com.raditha.watsim.analyzer;

import com.raditha.watsim.model.PairScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs build progress and cumulative elapsed time, one line per pair.
 */
public class ProgressLogger implements PairScoreListener {

    private static final Logger logger = LoggerFactory.getLogger(ProgressLogger.class);

    private final String metricName;
    private long cumulativeNanos;

    public ProgressLogger(String metricName) {
        this.metricName = metricName;
    }

    @Override
    public void onPairScored(PairScore pairScore) {
        cumulativeNanos += pairScore.elapsedNanos();
        logger.info("[{}] pair {}/{}: {} vs {} sim={} elapsed={}s",
                metricName,
                pairScore.pairNumber(),
                pairScore.totalPairs(),
                pairScore.first(),
                pairScore.second(),
                String.format("%.4f", pairScore.score()),
                String.format("%.2f", cumulativeNanos / 1e9));
    }

    public double elapsedSeconds() {
        return cumulativeNanos / 1e9;
    }
}
