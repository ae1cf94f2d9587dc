package org.calista.theorysynth.text.impl;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for UnicodeTokenizer.
 */
class UnicodeTokenizerTest {

    private final UnicodeTokenizer tokenizer = new UnicodeTokenizer();

    @Test
    @DisplayName("tokens are lowercase runs of letters and digits")
    void testBasicSplit() {
        assertEquals(List.of("energia", "cinética", "e", "2024"),
            tokenizer.tokenize("Energia-Cinética, e 2024!"));
    }

    @Test
    @DisplayName("decomposed accents compose to the same token")
    void testNfkcComposition() {
        List<String> decomposed = tokenizer.tokenize("cine\u0301tica");
        assertEquals(List.of("cin\u00e9tica"), decomposed);
    }

    @Test
    @DisplayName("blank or null input yields no tokens")
    void testBlank() {
        assertTrue(tokenizer.tokenize("   ").isEmpty());
        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenizer.tokenize("..???!!").isEmpty());
    }

    @Test
    @DisplayName("over-long tokens are cut at the configured length")
    void testMaxLength() {
        UnicodeTokenizer shortTok = new UnicodeTokenizer(5);
        assertEquals(List.of("abcde", "xy"), shortTok.tokenize("abcdefghij xy"));
    }
}
