package org.calista.theorysynth.synth;

import org.calista.theorysynth.text.NormalizedText;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MetricEngine.
 */
class MetricEngineTest {

    private final MetricEngine engine = new MetricEngine();

    private static NormalizedText text(List<String> sentences, List<String> tokens) {
        return new NormalizedText(String.join(" ", sentences), sentences, tokens, 100, 100);
    }

    @Test
    @DisplayName("one token or less returns the baselines")
    void testBaseline() {
        TextMetrics single = engine.measure(text(List.of("energia"), List.of("energia")),
            List.of(new Concept("energia", 2.0, 1, 0, false)));
        assertTrue(single.baseline);
        assertEquals(MetricEngine.BASELINE_COMPLEXITY, single.complexityScore);
        assertEquals(MetricEngine.BASELINE_COHERENCE, single.coherence);

        TextMetrics empty = engine.measure(text(List.of(), List.of()), List.of(Concept.synthetic("sinal")));
        assertTrue(empty.baseline);
        assertEquals(0, empty.totalTokens);
    }

    @Test
    @DisplayName("measured scores stay within [0, 1]")
    void testBounds() {
        List<String> tokens = List.of("campo", "rede", "campo", "sinal", "rede", "fluxo", "campo");
        List<Concept> concepts = new ConceptExtractor().extract(tokens);
        TextMetrics m = engine.measure(text(List.of("Campo rede campo.", "Sinal rede fluxo campo."), tokens), concepts);

        assertFalse(m.baseline);
        assertTrue(m.complexityScore >= 0.0 && m.complexityScore <= 1.0);
        assertTrue(m.coherence >= 0.0 && m.coherence <= 1.0);
        assertEquals(7, m.totalTokens);
        assertEquals(4, m.uniqueTokens);
        assertEquals(3.5, m.averageSentenceLength, 1e-9);
    }

    @Test
    @DisplayName("complexity grows with each of its inputs")
    void testComplexityMonotonic() {
        assertTrue(MetricEngine.complexityScore(0.8, 10, 0.2) > MetricEngine.complexityScore(0.4, 10, 0.2));
        assertTrue(MetricEngine.complexityScore(0.5, 30, 0.2) > MetricEngine.complexityScore(0.5, 5, 0.2));
        assertTrue(MetricEngine.complexityScore(0.5, 10, 0.6) > MetricEngine.complexityScore(0.5, 10, 0.1));
        assertTrue(MetricEngine.complexityScore(1.0, 1e9, 1.0) <= 1.0);
    }

    @Test
    @DisplayName("coherence falls as concept weights spread out")
    void testCoherenceMonotonic() {
        assertEquals(1.0, MetricEngine.coherenceScore(0.0));
        assertTrue(MetricEngine.coherenceScore(0.1) > MetricEngine.coherenceScore(0.5));
        assertTrue(MetricEngine.coherenceScore(1e12) >= 0.0);
        assertEquals(MetricEngine.BASELINE_COHERENCE, MetricEngine.coherenceScore(Double.NaN));
    }

    @Test
    @DisplayName("dispersion is zero for uniform weights or a single concept")
    void testDispersion() {
        assertEquals(0.0, MetricEngine.dispersion(List.of(new Concept("a1x", 2.0, 1, 0, false))));
        assertEquals(0.0, MetricEngine.dispersion(List.of(
            new Concept("abc", 2.0, 1, 0, false),
            new Concept("bcd", 2.0, 1, 1, false))));
        assertTrue(MetricEngine.dispersion(List.of(
            new Concept("abc", 6.0, 3, 0, false),
            new Concept("bcd", 1.0, 1, 1, false))) > 0.0);
    }

    @Test
    @DisplayName("non-finite values clamp to the fallback")
    void testClamp() {
        assertEquals(0.3, MetricEngine.clamp01(Double.NaN, 0.3));
        assertEquals(1.0, MetricEngine.clamp01(7.0, 0.3));
        assertEquals(0.0, MetricEngine.clamp01(-1.0, 0.3));
        assertEquals(0.0, MetricEngine.normalizeSentenceLength(0.0));
    }
}
