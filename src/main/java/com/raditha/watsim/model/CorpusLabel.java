package com.raditha.watsim.model;

/**
 * Identifies one program of the corpus: an algorithm compiled from one source
 * language.
 *
 * @param algorithm Algorithm name (e.g. "bubsort")
 * @param language  Source language (e.g. "rust")
 */
public record CorpusLabel(String algorithm, String language) {

    public CorpusLabel {
        if (algorithm == null || algorithm.isBlank()) {
            throw new IllegalArgumentException("algorithm cannot be blank");
        }
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("language cannot be blank");
        }
    }

    /**
     * Parse a label of the form {@code <algorithm>_<language>}.
     * The language is taken after the last underscore.
     */
    public static CorpusLabel parse(String label) {
        if (label == null) {
            throw new IllegalArgumentException("label cannot be null");
        }
        int idx = label.lastIndexOf('_');
        if (idx <= 0 || idx == label.length() - 1) {
            throw new IllegalArgumentException("Invalid corpus label: " + label
                    + ". Expected <algorithm>_<language>");
        }
        return new CorpusLabel(label.substring(0, idx), label.substring(idx + 1));
    }

    @Override
    public String toString() {
        return algorithm + "_" + language;
    }
}
