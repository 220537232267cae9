package com.raditha.watsim.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Occurrence counts of the contiguous n-token windows of one token sequence.
 * Keys are the window tokens joined by {@link #DELIMITER}; counts are
 * positive. Iteration follows first occurrence.
 */
public final class NGramTable {

    public static final String DELIMITER = " ";

    private final int n;
    private final Map<String, Integer> counts;
    private final long total;

    public NGramTable(int n, Map<String, Integer> counts) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1, got " + n);
        }
        this.n = n;
        Map<String, Integer> copy = new LinkedHashMap<>();
        long sum = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            int c = e.getValue();
            if (c <= 0) {
                throw new IllegalArgumentException("Count for '" + e.getKey() + "' must be positive, got " + c);
            }
            copy.put(e.getKey(), c);
            sum += c;
        }
        this.counts = Collections.unmodifiableMap(copy);
        this.total = sum;
    }

    public static NGramTable empty(int n) {
        return new NGramTable(n, Map.of());
    }

    public int n() {
        return n;
    }

    public int count(String key) {
        return counts.getOrDefault(key, 0);
    }

    public Set<String> keys() {
        return counts.keySet();
    }

    public Map<String, Integer> asMap() {
        return counts;
    }

    /**
     * Sum of all counts.
     */
    public long total() {
        return total;
    }

    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NGramTable other)) {
            return false;
        }
        return n == other.n && counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return 31 * n + counts.hashCode();
    }

    @Override
    public String toString() {
        return "NGramTable{n=" + n + ", keys=" + counts.size() + ", total=" + total + "}";
    }
}
