package com.raditha.watsim.corpus;

import com.raditha.watsim.config.WatSimConfig;
import com.raditha.watsim.detection.InstructionTokenizer;
import com.raditha.watsim.model.CorpusLabel;
import com.raditha.watsim.model.NGramTable;
import com.raditha.watsim.model.TokenSequence;
import com.raditha.watsim.ngram.NGramTableBuilder;
import com.raditha.watsim.ngram.NGramTableIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes gram files for WAT files so later runs can read the tables instead
 * of re-tokenizing.
 */
public class NGramExtractor {

    private static final Logger logger = LoggerFactory.getLogger(NGramExtractor.class);

    private final WatSimConfig config;
    private final InstructionTokenizer tokenizer;
    private final NGramTableBuilder tableBuilder;
    private final NGramTableIO tableIO;

    public NGramExtractor(WatSimConfig config) {
        this.config = config;
        this.tokenizer = new InstructionTokenizer();
        this.tableBuilder = new NGramTableBuilder();
        this.tableIO = new NGramTableIO();
    }

    /**
     * Write {@code grams/<algorithm><suffix>_<n>gram.txt} for every
     * configured n, next to the given text's item directory.
     *
     * @return number of files written
     */
    public int writeGrams(CorpusLayout layout, CorpusLabel label, String watText) throws IOException {
        TokenSequence tokens = tokenizer.tokenize(watText);
        Map<Integer, NGramTable> tables = tableBuilder.buildRange(tokens, config.minN(), config.maxN());
        Files.createDirectories(layout.gramsDir(label));
        for (NGramTable table : tables.values()) {
            Path out = layout.gramFile(label, table.n());
            tableIO.write(table, out);
            logger.debug("Saved {}-grams -> {}", table.n(), out);
        }
        return tables.size();
    }

    /**
     * Extract grams for every listed item that has a WAT file; missing items
     * are logged and skipped.
     *
     * @return number of items processed
     */
    public int extractCorpus(CorpusLayout layout, List<CorpusLabel> labels) throws IOException {
        layout.requireReadableRoot();
        int processed = 0;
        for (CorpusLabel label : labels) {
            Path wat = layout.watFile(label);
            if (!Files.exists(wat)) {
                logger.warn("File not found: {}", wat);
                continue;
            }
            writeGrams(layout, label, CorpusReader.readText(wat));
            processed++;
            logger.info("Extracted {}-{} grams for {}", config.minN(), config.maxN(), label);
        }
        return processed;
    }
}
