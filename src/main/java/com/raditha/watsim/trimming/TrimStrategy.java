package com.raditha.watsim.trimming;

/**
 * How a sequence is reduced to a target length.
 */
public enum TrimStrategy {
    /**
     * Keep the first elements.
     */
    HEAD,

    /**
     * Keep a centred window starting at {@code (total - target) / 2}.
     */
    MIDDLE,

    /**
     * Keep the last elements.
     */
    TAIL,

    /**
     * Keep a contiguous window at a seeded random offset.
     */
    RANDOM;

    public static TrimStrategy fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Trim method cannot be null");
        }
        return switch (value.trim().toLowerCase()) {
            case "head" -> HEAD;
            case "middle" -> MIDDLE;
            case "tail" -> TAIL;
            case "random" -> RANDOM;
            default -> throw new IllegalArgumentException(
                    "Invalid trim method: " + value + ". Must be: head, middle, tail, or random");
        };
    }

    public String toCliString() {
        return name().toLowerCase();
    }
}
