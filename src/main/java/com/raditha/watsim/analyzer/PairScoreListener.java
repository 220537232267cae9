package com.raditha.watsim.analyzer;

import com.raditha.watsim.model.PairScore;

/**
 * Observer notified after each unordered pair is scored. Listeners see
 * results only; they cannot change them.
 */
@FunctionalInterface
public interface PairScoreListener {

    void onPairScored(PairScore pairScore);
}
