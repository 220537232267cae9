package com.raditha.watsim.config;

/**
 * Where the n-gram tables of a corpus item come from.
 */
public enum NGramSource {
    /**
     * Tokenize the WAT text and count windows in memory.
     */
    WAT,

    /**
     * Read precomputed gram files next to the WAT file.
     */
    GRAM_FILES;

    public static NGramSource fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("n-gram source cannot be null");
        }
        return switch (value.trim().toLowerCase().replace('-', '_')) {
            case "wat" -> WAT;
            case "grams", "gram_files" -> GRAM_FILES;
            default -> throw new IllegalArgumentException(
                    "Invalid n-gram source: " + value + ". Must be: wat or grams");
        };
    }
}
