package com.raditha.watsim.model;

/**
 * One variant of a corpus program: the label plus the WAT text it was loaded
 * with. An empty text stands for a missing source.
 *
 * @param label Algorithm/language pair
 * @param text  WAT source text (never null)
 */
public record CorpusItem(CorpusLabel label, String text) {

    public CorpusItem {
        if (label == null) {
            throw new IllegalArgumentException("label cannot be null");
        }
        if (text == null) {
            text = "";
        }
    }

    public static CorpusItem missing(CorpusLabel label) {
        return new CorpusItem(label, "");
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
