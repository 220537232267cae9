package com.raditha.watsim.corpus;

import com.raditha.watsim.config.NGramSource;
import com.raditha.watsim.config.WatSimConfig;
import com.raditha.watsim.detection.InstructionTokenizer;
import com.raditha.watsim.model.CorpusItem;
import com.raditha.watsim.model.CorpusLabel;
import com.raditha.watsim.model.InstructionProfile;
import com.raditha.watsim.model.NGramTable;
import com.raditha.watsim.model.TokenSequence;
import com.raditha.watsim.ngram.NGramTableBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the per-item representations of a corpus once, before any pair is
 * scored.
 */
public class ProfileLoader {

    private static final Logger logger = LoggerFactory.getLogger(ProfileLoader.class);

    private final WatSimConfig config;
    private final CorpusReader reader;
    private final InstructionTokenizer tokenizer;
    private final NGramTableBuilder tableBuilder;

    public ProfileLoader(WatSimConfig config, CorpusReader reader) {
        this.config = config;
        this.reader = reader;
        this.tokenizer = new InstructionTokenizer();
        this.tableBuilder = new NGramTableBuilder();
    }

    /**
     * Load profiles for every configured target, in target order.
     *
     * @throws IllegalArgumentException if the corpus root is unusable
     */
    public List<InstructionProfile> loadTargets() {
        reader.layout().requireReadableRoot();
        List<InstructionProfile> profiles = new ArrayList<>();
        for (CorpusLabel label : config.targets()) {
            profiles.add(load(label));
        }
        return profiles;
    }

    /**
     * Load one item: tokens from its WAT text, tables either counted from
     * those tokens or read from gram files.
     */
    public InstructionProfile load(CorpusLabel label) {
        CorpusItem item = reader.readItem(label);
        return profileOf(item);
    }

    /**
     * Profile of an item already in memory.
     */
    public InstructionProfile profileOf(CorpusItem item) {
        TokenSequence tokens = tokenizer.tokenize(item.text());
        Map<Integer, NGramTable> tables;
        if (config.ngramSource() == NGramSource.GRAM_FILES) {
            tables = new TreeMap<>();
            for (int n = config.minN(); n <= config.maxN(); n++) {
                tables.put(n, reader.readGramTable(item.label(), n));
            }
        } else {
            tables = tableBuilder.buildRange(tokens, config.minN(), config.maxN());
        }
        logger.debug("Loaded {}: {} instructions", item.label(), tokens.size());
        return new InstructionProfile(item.label(), tokens, tables);
    }
}
