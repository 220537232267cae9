package com.raditha.watsim.trimming;

import java.util.List;
import java.util.Random;

/**
 * Reduces a sequence to a target length. No strategy reorders or duplicates
 * elements; when the sequence is already short enough it is returned whole.
 */
public final class Trimmer {

    private Trimmer() {
    }

    public static <T> TrimmedVariant<T> trim(List<T> elements, TrimStrategy strategy, int target, Random rng) {
        return switch (strategy) {
            case HEAD -> head(elements, target);
            case MIDDLE -> middle(elements, target);
            case TAIL -> tail(elements, target);
            case RANDOM -> {
                if (rng == null) {
                    throw new IllegalArgumentException("Random trimming requires a random generator");
                }
                yield randomWindow(elements, target, rng);
            }
        };
    }

    /**
     * Keep the first {@code target} elements.
     */
    public static <T> TrimmedVariant<T> head(List<T> elements, int target) {
        checkTarget(target);
        int kept = Math.min(target, elements.size());
        return variant(elements, TrimStrategy.HEAD, target, 0, kept);
    }

    /**
     * Keep the last {@code target} elements.
     */
    public static <T> TrimmedVariant<T> tail(List<T> elements, int target) {
        checkTarget(target);
        int kept = Math.min(target, elements.size());
        return variant(elements, TrimStrategy.TAIL, target, elements.size() - kept, kept);
    }

    /**
     * Keep a centred window of {@code target} elements.
     */
    public static <T> TrimmedVariant<T> middle(List<T> elements, int target) {
        checkTarget(target);
        int total = elements.size();
        if (target >= total) {
            return variant(elements, TrimStrategy.MIDDLE, target, 0, total);
        }
        int start = (total - target) / 2;
        return variant(elements, TrimStrategy.MIDDLE, target, start, target);
    }

    /**
     * Keep a contiguous window whose start is drawn uniformly from
     * {@code [0, total - target]}. The generator is not consulted when the
     * sequence is not longer than the target.
     */
    public static <T> TrimmedVariant<T> randomWindow(List<T> elements, int target, Random rng) {
        checkTarget(target);
        int total = elements.size();
        if (total <= target) {
            return variant(elements, TrimStrategy.RANDOM, target, 0, total);
        }
        int start = rng.nextInt(total - target + 1);
        return variant(elements, TrimStrategy.RANDOM, target, start, target);
    }

    private static <T> TrimmedVariant<T> variant(List<T> elements, TrimStrategy strategy, int target,
                                                 int start, int length) {
        return new TrimmedVariant<>(
                elements.subList(start, start + length),
                strategy,
                target,
                elements.size(),
                start,
                0,
                null);
    }

    private static void checkTarget(int target) {
        if (target < 0) {
            throw new IllegalArgumentException("Target length must be >= 0, got " + target);
        }
    }
}
