package com.raditha.watsim.corpus;

import com.raditha.watsim.CorpusFixture;
import com.raditha.watsim.config.NGramSource;
import com.raditha.watsim.config.WatSimConfig;
import com.raditha.watsim.model.CorpusLabel;
import com.raditha.watsim.model.InstructionProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProfileLoaderTest {

    @TempDir
    Path tempDir;

    private static final List<CorpusLabel> TARGETS = List.of(
            CorpusLabel.parse("bubsort_go"), CorpusLabel.parse("collatz_go"));

    @Test
    void testLoadFromWat() throws IOException {
        CorpusFixture.writeWat(tempDir, "bubsort_go", CorpusFixture.ADD_FUNC);
        WatSimConfig config = WatSimConfig.defaults().withTargets(TARGETS);

        List<InstructionProfile> profiles =
                new ProfileLoader(config, new CorpusReader(new CorpusLayout(tempDir, "_bg"))).loadTargets();

        assertEquals(2, profiles.size());
        InstructionProfile add = profiles.get(0);
        assertEquals(List.of("local.get", "local.get", "i32.add"), add.tokens().tokens());
        assertEquals(2, add.table(1).count("local.get"));
        assertEquals(1, add.table(3).total());
        assertTrue(add.table(4).isEmpty());

        InstructionProfile missing = profiles.get(1);
        assertTrue(missing.tokens().isEmpty());
        assertTrue(missing.table(1).isEmpty());
    }

    @Test
    void testLoadFromGramFiles() throws IOException {
        CorpusLayout layout = new CorpusLayout(tempDir, "_bg");
        CorpusLabel label = CorpusLabel.parse("bubsort_go");
        CorpusFixture.writeWat(tempDir, "bubsort_go", CorpusFixture.ADD_FUNC);
        Path unigrams = layout.gramFile(label, 1);
        Files.createDirectories(unigrams.getParent());
        Files.writeString(unigrams, "call\t9\n");

        WatSimConfig config = WatSimConfig.defaults()
                .withTargets(List.of(label))
                .withNGramSource(NGramSource.GRAM_FILES);
        InstructionProfile profile = new ProfileLoader(config, new CorpusReader(layout)).load(label);

        assertEquals(9, profile.table(1).count("call"));
        assertTrue(profile.table(2).isEmpty(), "Missing gram file reads as empty");
        assertEquals(3, profile.tokens().size(), "LCS still uses the WAT text");
    }

    @Test
    void testMissingRootIsConfigError() {
        WatSimConfig config = WatSimConfig.defaults();
        ProfileLoader loader = new ProfileLoader(config,
                new CorpusReader(new CorpusLayout(tempDir.resolve("absent"), "_bg")));

        assertThrows(IllegalArgumentException.class, loader::loadTargets);
    }
}
