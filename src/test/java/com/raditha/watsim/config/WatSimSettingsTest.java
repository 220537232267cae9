package com.raditha.watsim.config;

import com.raditha.watsim.model.CorpusLabel;
import com.raditha.watsim.similarity.LcsNormalization;
import com.raditha.watsim.trimming.TrimStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WatSimSettingsTest {

    @TempDir
    Path tempDir;

    private Path writeYaml(String content) throws IOException {
        Path file = tempDir.resolve("watsim.yml");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testNoConfigUsesDefaults() throws IOException {
        Map<String, Object> yaml = WatSimSettings.readYaml(null);

        assertEquals(WatSimConfig.defaults(), WatSimSettings.loadConfig(yaml, null, null, null, null, null));

        TrimConfig trim = WatSimSettings.loadTrimConfig(yaml, null, null, null, null, null, null);
        assertEquals(TrimStrategy.RANDOM, trim.strategy());
        assertEquals(500, trim.targetLength());
        assertEquals(10, trim.trials());
        assertNull(trim.masterSeed());
        assertTrue(trim.writeGrams());
    }

    @Test
    void testYamlValues() throws IOException {
        Path file = writeYaml("""
                similarity:
                  min_n: 2
                  max_n: 4
                  lcs_method: avg
                  ngram_source: grams
                  gram_suffix: ""
                  targets: [collatz_go, bubble_sort_c]
                trimming:
                  method: head
                  lines: 300
                  seed: 7
                  algos: [collatz]
                  langs: go, c
                  write_grams: false
                """);
        Map<String, Object> yaml = WatSimSettings.readYaml(file);

        WatSimConfig config = WatSimSettings.loadConfig(yaml, null, null, null, null, null);
        assertEquals(2, config.minN());
        assertEquals(4, config.maxN());
        assertEquals(LcsNormalization.AVG, config.lcsNormalization());
        assertEquals(NGramSource.GRAM_FILES, config.ngramSource());
        assertEquals("", config.gramFileSuffix());
        assertEquals(List.of(new CorpusLabel("collatz", "go"), new CorpusLabel("bubble_sort", "c")),
                config.targets());

        TrimConfig trim = WatSimSettings.loadTrimConfig(yaml, null, null, null, null, null, null);
        assertEquals(TrimStrategy.HEAD, trim.strategy());
        assertEquals(300, trim.targetLength());
        assertEquals(7L, trim.masterSeed());
        assertEquals(List.of("collatz"), trim.algorithms());
        assertEquals(List.of("go", "c"), trim.languages());
        assertFalse(trim.writeGrams());
    }

    @Test
    void testCliOverridesYaml() throws IOException {
        Path file = writeYaml("""
                similarity:
                  min_n: 2
                  lcs_method: avg
                trimming:
                  method: head
                  lines: 300
                """);
        Map<String, Object> yaml = WatSimSettings.readYaml(file);

        WatSimConfig config = WatSimSettings.loadConfig(yaml, 1, 3, "max", "fizzbuzz_c,fizzbuzz_go", "wat");
        assertEquals(1, config.minN());
        assertEquals(3, config.maxN());
        assertEquals(LcsNormalization.MAX, config.lcsNormalization());
        assertEquals(2, config.targets().size());
        assertNull(config.lcsLimit());

        TrimConfig trim = WatSimSettings.loadTrimConfig(yaml, "tail", 50, 3, 99L, "fizzbuzz", "c");
        assertEquals(TrimStrategy.TAIL, trim.strategy());
        assertEquals(50, trim.targetLength());
        assertEquals(3, trim.trials());
        assertEquals(99L, trim.masterSeed());
    }

    @Test
    void testLcsLimit() throws IOException {
        Map<String, Object> yaml = WatSimSettings.readYaml(writeYaml("similarity:\n  lcs_limit: 2000\n"));

        assertEquals(Integer.valueOf(2000), WatSimSettings.loadConfig(yaml, null, null, null, null, null).lcsLimit());
        assertEquals(Integer.valueOf(50), WatSimSettings.loadConfig(yaml, null, null, null, null, null, 50).lcsLimit());
        assertNull(WatSimSettings.loadConfig(Map.of(), null, null, null, null, null, null).lcsLimit());
    }

    @Test
    void testInvalidValuesAreConfigErrors() throws IOException {
        Map<String, Object> yaml = WatSimSettings.readYaml(writeYaml("similarity:\n  lcs_method: median\n"));

        assertThrows(IllegalArgumentException.class,
                () -> WatSimSettings.loadConfig(yaml, null, null, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> WatSimSettings.loadTrimConfig(Map.of(), "sideways", null, null, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> WatSimSettings.readYaml(tempDir.resolve("missing.yml")));
    }

    @Test
    void testSplitList() {
        assertEquals(List.of("a", "b"), WatSimSettings.splitList(" a, ,b ,"));
    }
}
