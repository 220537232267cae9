package com.raditha.watsim.corpus;

import com.raditha.watsim.model.CorpusItem;
import com.raditha.watsim.model.CorpusLabel;
import com.raditha.watsim.model.NGramTable;
import com.raditha.watsim.ngram.NGramTableIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads corpus files. A missing or unreadable file is logged and read as
 * empty so that every metric scores the affected pairs as 0.0.
 */
public class CorpusReader {

    private static final Logger logger = LoggerFactory.getLogger(CorpusReader.class);

    private final CorpusLayout layout;
    private final NGramTableIO tableIO;

    public CorpusReader(CorpusLayout layout) {
        this.layout = layout;
        this.tableIO = new NGramTableIO();
    }

    public CorpusLayout layout() {
        return layout;
    }

    /**
     * Load the WAT text of one item.
     */
    public CorpusItem readItem(CorpusLabel label) {
        Path wat = layout.watFile(label);
        if (!Files.exists(wat)) {
            logger.warn("File not found: {}", wat);
            return CorpusItem.missing(label);
        }
        try {
            return new CorpusItem(label, readText(wat));
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", wat, e.getMessage());
            return CorpusItem.missing(label);
        }
    }

    /**
     * Load one precomputed gram file.
     */
    public NGramTable readGramTable(CorpusLabel label, int n) {
        Path file = layout.gramFile(label, n);
        if (!Files.exists(file)) {
            logger.warn("File not found: {}", file);
            return NGramTable.empty(n);
        }
        try {
            return tableIO.read(file, n);
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", file, e.getMessage());
            return NGramTable.empty(n);
        }
    }

    /**
     * Read a text file as UTF-8, replacing malformed bytes.
     */
    static String readText(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }
}
