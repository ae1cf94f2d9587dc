package org.calista.theorysynth.synth;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeywordMatcher.
 */
class KeywordMatcherTest {

    @Test
    @DisplayName("stems match at the start of the symbol")
    void testPrefix() {
        assertTrue(KeywordMatcher.matches("cinetica", "cinetic"));
        assertTrue(KeywordMatcher.matches("oscilacao", "oscil"));
        assertTrue(KeywordMatcher.matches("ritmo", "ritm"));
        assertTrue(KeywordMatcher.matches("rede", "redes"));
    }

    @Test
    @DisplayName("keywords inside another word do not match")
    void testNoInfix() {
        assertFalse(KeywordMatcher.matches("algoritmo", "ritm"));
        assertFalse(KeywordMatcher.matches("ferro", "erro"));
        assertFalse(KeywordMatcher.matches("context", "text"));
    }

    @Test
    @DisplayName("short keywords behave as whole words")
    void testShortKeywords() {
        assertTrue(KeywordMatcher.matches("som", "som"));
        assertTrue(KeywordMatcher.matches("metas", "meta"));
        assertFalse(KeywordMatcher.matches("sombra", "som"));
        assertFalse(KeywordMatcher.matches("metade", "meta"));
    }

    @Test
    @DisplayName("overlap counts matched keywords and ignores empty input")
    void testOverlap() {
        assertEquals(2, KeywordMatcher.overlap("energia", List.of("energ", "energi", "calor")));
        assertEquals(0, KeywordMatcher.overlap("quorp", SystemArchetype.COUPLED_OSCILLATOR.keywords));
        assertFalse(KeywordMatcher.matches("", "som"));
        assertFalse(KeywordMatcher.matches(null, "som"));
    }
}
