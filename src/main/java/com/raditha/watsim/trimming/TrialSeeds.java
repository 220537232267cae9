package com.raditha.watsim.trimming;

import java.util.Random;

/**
 * Two-level seeding for random trims: a master seed drives a generator that
 * hands out one sub-seed per trial. The same master seed reproduces every
 * trial, while trials differ from each other.
 */
public final class TrialSeeds {

    private final long masterSeed;
    private final long[] seeds;

    private TrialSeeds(long masterSeed, long[] seeds) {
        this.masterSeed = masterSeed;
        this.seeds = seeds;
    }

    /**
     * @param masterSeed Master seed; null draws a fresh one (reported by {@link #masterSeed()})
     * @param trials     Number of trials, at least 1
     */
    public static TrialSeeds derive(Long masterSeed, int trials) {
        if (trials < 1) {
            throw new IllegalArgumentException("trials must be >= 1, got " + trials);
        }
        long master = masterSeed != null ? masterSeed : new Random().nextLong();
        Random base = new Random(master);
        long[] seeds = new long[trials];
        for (int i = 0; i < trials; i++) {
            seeds[i] = base.nextInt(Integer.MAX_VALUE);
        }
        return new TrialSeeds(master, seeds);
    }

    public long masterSeed() {
        return masterSeed;
    }

    public int trials() {
        return seeds.length;
    }

    /**
     * Seed for a 1-based trial number.
     */
    public long seedFor(int trial) {
        if (trial < 1 || trial > seeds.length) {
            throw new IllegalArgumentException(
                    String.format("Trial %d out of range 1..%d", trial, seeds.length));
        }
        return seeds[trial - 1];
    }

    /**
     * Fresh generator for a 1-based trial number.
     */
    public Random generatorFor(int trial) {
        return new Random(seedFor(trial));
    }
}
