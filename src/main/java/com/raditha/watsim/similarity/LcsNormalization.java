package com.raditha.watsim.similarity;

/**
 * Denominator used to turn an LCS length into a score.
 */
public enum LcsNormalization {
    /**
     * L / min(len1, len2). Rewards a short program embedded in a long one.
     */
    MIN,

    /**
     * 2L / (len1 + len2).
     */
    AVG,

    /**
     * L / max(len1, len2). The strictest of the three.
     */
    MAX;

    /**
     * Score for an LCS length. Both lengths must be positive.
     */
    public double normalize(int lcsLength, int len1, int len2) {
        return switch (this) {
            case MIN -> (double) lcsLength / Math.min(len1, len2);
            case AVG -> 2.0 * lcsLength / (len1 + len2);
            case MAX -> (double) lcsLength / Math.max(len1, len2);
        };
    }

    /**
     * @param value min, avg or max (case-insensitive)
     * @throws IllegalArgumentException for any other value
     */
    public static LcsNormalization fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("LCS method cannot be null");
        }
        return switch (value.trim().toLowerCase()) {
            case "min" -> MIN;
            case "avg" -> AVG;
            case "max" -> MAX;
            default -> throw new IllegalArgumentException(
                    "Unknown LCS method: " + value + ". Must be: min, avg, or max");
        };
    }

    public String toCliString() {
        return name().toLowerCase();
    }
}
