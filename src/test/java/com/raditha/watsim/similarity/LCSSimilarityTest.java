package com.raditha.watsim.similarity;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LCSSimilarity.
 */
class LCSSimilarityTest {

    private static final List<String> LONG = List.of("local.get", "local.get", "i32.add", "call", "drop");
    private static final List<String> SHORT = List.of("local.get", "i32.add", "return");

    private LCSSimilarity similarity;

    @BeforeEach
    void setUp() {
        similarity = new LCSSimilarity();
    }

    @Test
    void testIdenticalSequences() {
        assertEquals(1.0, similarity.calculate(LONG, List.copyOf(LONG)), 0.001);
    }

    @Test
    void testCompletelyDifferent() {
        assertEquals(0.0, similarity.calculate(List.of("nop"), List.of("drop")), 0.001);
    }

    @Test
    void testEmptySequence() {
        assertEquals(0.0, similarity.calculate(List.of(), LONG));
        assertEquals(0.0, similarity.calculate(LONG, List.of()));
        assertEquals(0.0, similarity.calculate(List.of(), List.of()));
    }

    @Test
    void testLcsLength() {
        assertEquals(2, LCSSimilarity.lcsLength(LONG, SHORT));
        assertEquals(2, LCSSimilarity.lcsLength(SHORT, LONG));
        assertEquals(0, LCSSimilarity.lcsLength(List.of(), SHORT));
    }

    @Test
    void testNormalizations() {
        // LCS = 2 (local.get, i32.add); lengths 5 and 3
        assertEquals(2.0 / 3.0, new LCSSimilarity(LcsNormalization.MIN).calculate(LONG, SHORT), 1e-9);
        assertEquals(4.0 / 8.0, new LCSSimilarity(LcsNormalization.AVG).calculate(LONG, SHORT), 1e-9);
        assertEquals(2.0 / 5.0, new LCSSimilarity(LcsNormalization.MAX).calculate(LONG, SHORT), 1e-9);
    }

    @Test
    void testEmbeddedProgramUnderMin() {
        List<String> inner = List.of("i32.add", "call");

        assertEquals(1.0, similarity.calculate(inner, LONG), 1e-9);
    }

    @Test
    void testUnknownNormalization() {
        assertThrows(IllegalArgumentException.class, () -> LcsNormalization.fromString("median"));
        assertThrows(IllegalArgumentException.class, () -> LcsNormalization.fromString(null));
        assertEquals(LcsNormalization.AVG, LcsNormalization.fromString(" AVG "));
    }

    @Property(tries = 200)
    void normalizationsAreOrdered(
            @ForAll @Size(min = 1, max = 15) List<@StringLength(min = 1, max = 1) String> a,
            @ForAll @Size(min = 1, max = 15) List<@StringLength(min = 1, max = 1) String> b) {
        int lcs = LCSSimilarity.lcsLength(a, b);
        assertTrue(lcs <= Math.min(a.size(), b.size()));

        double min = new LCSSimilarity(LcsNormalization.MIN).calculate(a, b);
        double avg = new LCSSimilarity(LcsNormalization.AVG).calculate(a, b);
        double max = new LCSSimilarity(LcsNormalization.MAX).calculate(a, b);

        assertTrue(min >= avg - 1e-12 && avg >= max - 1e-12, min + " " + avg + " " + max);
        if (a.size() == b.size()) {
            assertEquals(min, avg, 1e-12);
            assertEquals(avg, max, 1e-12);
        }
        assertEquals(min, new LCSSimilarity(LcsNormalization.MIN).calculate(b, a), 1e-12);
    }
}
