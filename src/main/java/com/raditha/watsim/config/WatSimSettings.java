package com.raditha.watsim.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.watsim.model.CorpusLabel;
import com.raditha.watsim.similarity.LcsNormalization;
import com.raditha.watsim.trimming.TrimStrategy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Loads similarity and trimming configuration from a YAML file (watsim.yml)
 * with CLI overrides.
 *
 * Configuration priority: CLI arguments > watsim.yml > defaults
 *
 * <pre>
 * similarity:
 *   min_n: 1
 *   max_n: 6
 *   lcs_method: min
 *   ngram_source: wat
 *   gram_suffix: _bg
 *   lcs_limit: 2000
 *   targets: [bubsort_go, collatz_go]
 * trimming:
 *   method: random
 *   lines: 500
 *   trials: 10
 *   seed: 42
 *   algos: [bubsort, collatz]
 *   langs: [c, go]
 *   write_grams: true
 * </pre>
 */
public class WatSimSettings {

    public static final String SIMILARITY_KEY = "similarity";
    public static final String TRIMMING_KEY = "trimming";
    public static final int DEFAULT_TRIM_LINES = 500;

    private static final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    private WatSimSettings() {
    }

    /**
     * Read a YAML configuration file into a map.
     *
     * @param file YAML file; null yields an empty map
     * @throws IllegalArgumentException if the file does not exist
     */
    public static Map<String, Object> readYaml(Path file) throws IOException {
        if (file == null) {
            return Map.of();
        }
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Config file not found: " + file);
        }
        Map<String, Object> map = mapper.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {
        });
        return map != null ? map : Map.of();
    }

    /**
     * Build the matrix configuration. Null CLI parameters fall back to YAML,
     * then to {@link WatSimConfig#defaults()}.
     */
    public static WatSimConfig loadConfig(
            Map<String, Object> yaml,
            Integer minNCLI,
            Integer maxNCLI,
            String lcsMethodCLI,
            String targetsCLI,
            String ngramSourceCLI) {
        return loadConfig(yaml, minNCLI, maxNCLI, lcsMethodCLI, targetsCLI, ngramSourceCLI, null);
    }

    /**
     * As above, with an LCS instruction limit override.
     */
    public static WatSimConfig loadConfig(
            Map<String, Object> yaml,
            Integer minNCLI,
            Integer maxNCLI,
            String lcsMethodCLI,
            String targetsCLI,
            String ngramSourceCLI,
            Integer lcsLimitCLI) {
        Map<String, Object> config = section(yaml, SIMILARITY_KEY);
        WatSimConfig defaults = WatSimConfig.defaults();

        int minN = minNCLI != null ? minNCLI : getInt(config, "min_n", defaults.minN());
        int maxN = maxNCLI != null ? maxNCLI : getInt(config, "max_n", defaults.maxN());

        String lcsMethod = lcsMethodCLI != null ? lcsMethodCLI : getString(config, "lcs_method", null);
        LcsNormalization normalization = lcsMethod != null
                ? LcsNormalization.fromString(lcsMethod)
                : defaults.lcsNormalization();

        List<String> rawTargets = targetsCLI != null ? splitList(targetsCLI) : getListString(config, "targets");
        List<CorpusLabel> targets = rawTargets.isEmpty()
                ? defaults.targets()
                : rawTargets.stream().map(CorpusLabel::parse).toList();

        String source = ngramSourceCLI != null ? ngramSourceCLI : getString(config, "ngram_source", null);
        NGramSource ngramSource = source != null ? NGramSource.fromString(source) : defaults.ngramSource();

        String gramSuffix = getString(config, "gram_suffix", defaults.gramFileSuffix());

        Integer lcsLimit = lcsLimitCLI != null ? lcsLimitCLI : getInteger(config, "lcs_limit");

        return new WatSimConfig(minN, maxN, normalization, targets, gramSuffix, ngramSource, lcsLimit);
    }

    /**
     * Build the trimming configuration. Null CLI parameters fall back to YAML,
     * then to defaults (random strategy, 500 lines, 10 trials).
     */
    public static TrimConfig loadTrimConfig(
            Map<String, Object> yaml,
            String methodCLI,
            Integer linesCLI,
            Integer trialsCLI,
            Long seedCLI,
            String algosCLI,
            String langsCLI) {
        Map<String, Object> config = section(yaml, TRIMMING_KEY);
        TrimConfig defaults = TrimConfig.random(DEFAULT_TRIM_LINES, null);

        String method = methodCLI != null ? methodCLI : getString(config, "method", defaults.strategy().toCliString());
        TrimStrategy strategy = TrimStrategy.fromString(method);
        int lines = linesCLI != null ? linesCLI : getInt(config, "lines", defaults.targetLength());
        int trials = trialsCLI != null ? trialsCLI : getInt(config, "trials", defaults.trials());
        Long seed = seedCLI != null ? seedCLI : getLong(config, "seed");
        List<String> algos = algosCLI != null ? splitList(algosCLI) : getListString(config, "algos");
        List<String> langs = langsCLI != null ? splitList(langsCLI) : getListString(config, "langs");
        boolean writeGrams = getBoolean(config, "write_grams", defaults.writeGrams());

        return new TrimConfig(strategy, lines, trials, seed, algos, langs, writeGrams);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> yaml, String key) {
        if (yaml == null) {
            return Map.of();
        }
        Object raw = yaml.get(key);
        if (raw instanceof Map) {
            return (Map<String, Object>) raw;
        }
        return Map.of();
    }

    static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static Integer getInteger(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return null;
    }

    private static Long getLong(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return null;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) {
                out.add(String.valueOf(o));
            }
            return out;
        }
        if (value instanceof String s) {
            return splitList(s);
        }
        return List.of();
    }
}
