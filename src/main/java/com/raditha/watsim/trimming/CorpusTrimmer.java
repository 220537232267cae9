package com.raditha.watsim.trimming;

import com.raditha.watsim.config.TrimConfig;
import com.raditha.watsim.config.WatSimConfig;
import com.raditha.watsim.corpus.CorpusLayout;
import com.raditha.watsim.corpus.NGramExtractor;
import com.raditha.watsim.model.CorpusLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Produces trimmed copies of a corpus tree.
 *
 * Deterministic strategies write one variant directory named after the
 * strategy ({@code <out>/head/<algo>/<lang>/<algo>.wat}); the random strategy
 * writes one directory per trial ({@code <out>/3/<algo>/<lang>/<algo>.wat}).
 * Each variant directory gets a {@code trim_log.csv} audit file.
 */
public class CorpusTrimmer {

    private static final Logger logger = LoggerFactory.getLogger(CorpusTrimmer.class);

    public static final String AUDIT_FILE = "trim_log.csv";

    private final WatSimConfig config;
    private final NGramExtractor extractor;

    public CorpusTrimmer(WatSimConfig config) {
        this.config = config;
        this.extractor = new NGramExtractor(config);
    }

    /**
     * Trim every configured algorithm/language present under the input root.
     *
     * @param inputRoot  Untrimmed corpus root
     * @param outputRoot Directory receiving the variant directories
     * @param trimConfig What to keep
     * @return summary with one audit record per written file
     * @throws IllegalArgumentException if the input root is unusable
     * @throws IOException              if an output cannot be written
     */
    public TrimReport run(Path inputRoot, Path outputRoot, TrimConfig trimConfig) throws IOException {
        CorpusLayout input = new CorpusLayout(inputRoot, config.gramFileSuffix());
        input.requireReadableRoot();

        TrialSeeds seeds = null;
        if (trimConfig.strategy() == TrimStrategy.RANDOM) {
            seeds = TrialSeeds.derive(trimConfig.masterSeed(), trimConfig.trials());
            logger.info("Random trimming: master seed {}, {} trials", seeds.masterSeed(), seeds.trials());
        }

        List<TrimAuditRecord> allRecords = new ArrayList<>();
        int skipped = 0;
        long originalBytes = 0;
        long trimmedBytes = 0;

        for (int trial = 1; trial <= trimConfig.variantCount(); trial++) {
            String variantName = seeds != null ? Integer.toString(trial) : trimConfig.strategy().toCliString();
            Path variantDir = outputRoot.resolve(variantName);
            CorpusLayout output = new CorpusLayout(variantDir, config.gramFileSuffix());
            Random rng = seeds != null ? seeds.generatorFor(trial) : null;

            List<TrimAuditRecord> records = new ArrayList<>();
            for (String algorithm : trimConfig.algorithms()) {
                for (String language : trimConfig.languages()) {
                    CorpusLabel label = new CorpusLabel(algorithm, language);
                    Path source = input.watFile(label);
                    if (!Files.exists(source)) {
                        logger.warn("[SKIP] {}: input file not found", label);
                        skipped++;
                        continue;
                    }

                    List<String> lines = readLines(source);
                    TrimmedVariant<String> trimmed = Trimmer.trim(
                            lines, trimConfig.strategy(), trimConfig.targetLength(), rng);
                    if (seeds != null) {
                        trimmed = trimmed.forTrial(trial, seeds.seedFor(trial));
                    }

                    Path target = output.watFile(label);
                    String text = joinLines(trimmed.elements());
                    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
                    Files.createDirectories(target.getParent());
                    Files.write(target, bytes);
                    originalBytes += Files.size(source);
                    trimmedBytes += bytes.length;
                    if (trimConfig.writeGrams()) {
                        extractor.writeGrams(output, label, text);
                    }

                    TrimAuditRecord record = new TrimAuditRecord(
                            variantName,
                            algorithm,
                            language,
                            input.itemDir(label).relativize(source).toString().replace('\\', '/'),
                            trimmed.originalLength(),
                            trimmed.keptLength(),
                            trimmed.startOffset());
                    records.add(record);
                    logger.info("[OK] {}/{} {}: {} -> {} lines (start {})", variantName, algorithm, language,
                            record.totalLines(), record.keptLines(), record.startIndex());
                }
            }

            writeAuditLog(variantDir.resolve(AUDIT_FILE), records);
            allRecords.addAll(records);
        }

        return new TrimReport(
                trimConfig.strategy(),
                trimConfig.targetLength(),
                seeds != null ? seeds.masterSeed() : null,
                allRecords,
                skipped,
                originalBytes,
                trimmedBytes);
    }

    /**
     * Write the audit CSV for one variant.
     */
    public static void writeAuditLog(Path file, List<TrimAuditRecord> records) throws IOException {
        Files.createDirectories(file.getParent());
        StringBuilder csv = new StringBuilder();
        csv.append(TrimAuditRecord.CSV_HEADER).append('\n');
        for (TrimAuditRecord record : records) {
            csv.append(record.toCsvRow()).append('\n');
        }
        Files.writeString(file, csv.toString(), StandardCharsets.UTF_8);
    }

    static List<String> readLines(Path file) throws IOException {
        return splitKeepingTerminators(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    /**
     * Split text into lines that keep their {@code \n}, {@code \r\n} or
     * {@code \r} terminator. The last line has none if the text does not
     * end with one.
     */
    static List<String> splitKeepingTerminators(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            }
            i++;
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    static String joinLines(List<String> lines) {
        return String.join("", lines);
    }
}
