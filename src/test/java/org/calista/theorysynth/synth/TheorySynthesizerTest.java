package org.calista.theorysynth.synth;

import org.calista.theorysynth.InvalidInputException;
import org.calista.theorysynth.model.Formula;
import org.calista.theorysynth.model.Medium;
import org.calista.theorysynth.model.ParameterEntry;
import org.calista.theorysynth.model.SourceDescriptor;
import org.calista.theorysynth.model.SystemModel;
import org.calista.theorysynth.model.TheorySynthesis;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for TheorySynthesizer: scenarios and output properties.
 */
class TheorySynthesizerTest {

    private static final String PARAGRAPH =
        "A energia cinética das partículas alimenta a rede de sinais. "
            + "Cada sinal propaga uma onda pelo campo, e a taxa de crescimento depende do fluxo de calor. "
            + "O sistema se organiza por realimentação e controle!";

    private static TheorySynthesizer synth;

    @BeforeAll
    static void setUp() {
        synth = TheorySynthesizer.withDefaults();
    }

    private static SourceDescriptor text(String content) {
        return SourceDescriptor.forText(content);
    }

    private static void assertComplete(TheorySynthesis t) {
        assertFalse(t.coreThesis.isBlank());
        assertFalse(t.phenomena.isEmpty());
        assertFalse(t.derivedFormulas.isEmpty());
        assertFalse(t.systemModels.isEmpty());
        assertFalse(t.parameterTable.isEmpty());
        assertFalse(t.inferenceSteps.isEmpty());
        assertFalse(t.recommendedExperiments.isEmpty());

        assertTrue(t.derivedFormulas.size() <= 5);
        assertTrue(t.systemModels.size() <= 2);
        assertTrue(t.phenomena.size() <= 4);
        assertEquals(InferenceNarrator.STEP_COUNT, t.inferenceSteps.size());
        assertTrue(t.recommendedExperiments.size() >= 2 && t.recommendedExperiments.size() <= 4);

        assertTrue(t.complexityScore >= 0.0 && t.complexityScore <= 1.0, "complexity " + t.complexityScore);
        assertTrue(t.coherence >= 0.0 && t.coherence <= 1.0, "coherence " + t.coherence);
        assertClosure(t);
    }

    private static void assertClosure(TheorySynthesis t) {
        StringBuilder all = new StringBuilder();
        for (Formula f : t.derivedFormulas) all.append(f.expression).append('\n');
        for (SystemModel m : t.systemModels) all.append(m.governingEquation).append('\n');

        List<String> seen = new ArrayList<>();
        for (ParameterEntry p : t.parameterTable) {
            assertTrue(all.indexOf(p.label) >= 0, "label not in any expression: " + p.label);
            assertFalse(seen.contains(p.label), "duplicate label: " + p.label);
            seen.add(p.label);
        }
    }

    // ---------------------------------------------------------------------
    // Scenarios
    // ---------------------------------------------------------------------

    @Test
    @DisplayName("a single word produces a complete synthesis")
    void testSingleWord() {
        TheorySynthesis t = synth.synthesize("energia", text("energia"));

        assertComplete(t);
        assertEquals("E = ½·κ·energia² + U(energia)", t.derivedFormulas.get(0).expression);
        assertEquals(MetricEngine.BASELINE_COMPLEXITY, t.complexityScore);
        assertEquals(MetricEngine.BASELINE_COHERENCE, t.coherence);
    }

    @Test
    @DisplayName("the same text as text and as pdf differs only in the signal profile")
    void testMediumOnlyChangesProfile() {
        String content = "energia cinética";
        TheorySynthesis asText = synth.synthesize(content, SourceDescriptor.of(Medium.TEXT, content.length()));
        TheorySynthesis asPdf = synth.synthesize(content, SourceDescriptor.of(Medium.PDF, content.length()));

        assertEquals(asText.phenomena, asPdf.phenomena);
        assertEquals(asText.derivedFormulas, asPdf.derivedFormulas);
        assertEquals(asText.complexityScore, asPdf.complexityScore);
        assertEquals(asText.coherence, asPdf.coherence);
        assertEquals(asText.coreThesis, asPdf.coreThesis);

        assertEquals(Medium.TEXT, asText.signalProfile.medium);
        assertEquals(Medium.PDF, asPdf.signalProfile.medium);
        assertNotEquals(asText, asPdf);
    }

    @Test
    @DisplayName("a paragraph repeated 1000 times respects every cap")
    void testRepeatedParagraph() {
        String content = (PARAGRAPH + " ").repeat(1000);
        TheorySynthesis t = synth.synthesize(content, text(content));

        assertComplete(t);
        assertTrue(t.inferenceSteps.get(0).contains("entrada limitada aos primeiros"));
    }

    @Test
    @DisplayName("empty or blank content is rejected without a result")
    void testEmptyRejected() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
            () -> synth.synthesize("", SourceDescriptor.of(Medium.TEXT, 0)));
        assertEquals(InvalidInputException.Kind.BLANK_CONTENT, e.kind());

        assertThrows(InvalidInputException.class, () -> synth.synthesize("   \n\t", SourceDescriptor.of(Medium.TEXT, 4)));
        assertThrows(InvalidInputException.class, () -> synth.synthesize(null, SourceDescriptor.of(Medium.TEXT, 0)));
        assertThrows(NullPointerException.class, () -> synth.synthesize("energia", null));
    }

    @Test
    @DisplayName("punctuation-only content falls back to the synthetic concept and baselines")
    void testPunctuationOnly() {
        TheorySynthesis t = synth.synthesize("..???!!", text("..???!!"));

        assertComplete(t);
        assertEquals(MetricEngine.BASELINE_COMPLEXITY, t.complexityScore);
        assertEquals(MetricEngine.BASELINE_COHERENCE, t.coherence);
        assertTrue(t.coreThesis.contains(ConceptExtractor.FALLBACK_TERM));
        assertFalse(t.coreThesis.contains("Trecho de referência"));
    }

    // ---------------------------------------------------------------------
    // Properties
    // ---------------------------------------------------------------------

    @Test
    @DisplayName("repeated calls return identical output")
    void testDeterminism() {
        SourceDescriptor d = text(PARAGRAPH).withContextTag("notas.txt").withNote("primeira leitura");
        assertEquals(synth.synthesize(PARAGRAPH, d), synth.synthesize(PARAGRAPH, d));
        assertEquals(synth.synthesize(PARAGRAPH, d), TheorySynthesizer.withDefaults().synthesize(PARAGRAPH, d));
    }

    @Test
    @DisplayName("scores stay bounded for lengths from 1 to 100000 characters")
    void testScoreBounds() {
        Random rnd = new Random(42);
        String alphabet = "abcdefghijklmnopqrstuvwxyzáéíóúãõç      .,;!?0123456789\n";
        int[] lengths = {1, 2, 3, 7, 50, 333, 1_000, 10_000, 20_001, 100_000};

        for (int len : lengths) {
            StringBuilder b = new StringBuilder(len);
            b.append('x');
            while (b.length() < len) b.append(alphabet.charAt(rnd.nextInt(alphabet.length())));
            String content = b.toString();

            assertComplete(synth.synthesize(content, text(content)));

            String prose = PARAGRAPH.repeat(len / PARAGRAPH.length() + 1).substring(0, len);
            if (!prose.isBlank()) assertComplete(synth.synthesize(prose, text(prose)));
        }
    }

    @Test
    @DisplayName("non-linguistic input still yields a complete synthesis")
    void testOddInputs() {
        for (String s : List.of("a", "12345", "x", "de de de", "😀😀😀", "ok.", "rede rede rede rede rede")) {
            assertComplete(synth.synthesize(s, text(s)));
        }
    }

    @Test
    @DisplayName("the signal profile echoes the descriptor")
    void testSignalProfile() {
        SourceDescriptor d = SourceDescriptor.of(Medium.AUDIO, 120)
            .withContextTag("gravacao.wav")
            .withNote("Transcrição sintética gerada via metadados.");
        TheorySynthesis t = synth.synthesize(PARAGRAPH, d);

        assertEquals(Medium.AUDIO, t.signalProfile.medium);
        assertEquals("gravacao.wav", t.signalProfile.contextTag);
        assertEquals(List.of("Transcrição sintética gerada via metadados."), t.signalProfile.additionalNotes);
    }

    @Test
    @DisplayName("one instance serves concurrent callers with identical results")
    void testConcurrentCalls() throws Exception {
        TheorySynthesis expected = synth.synthesize(PARAGRAPH, text(PARAGRAPH));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<TheorySynthesis>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(pool.submit(() -> synth.synthesize(PARAGRAPH, text(PARAGRAPH))));
            }
            for (Future<TheorySynthesis> f : futures) assertEquals(expected, f.get());
        } finally {
            pool.shutdownNow();
        }
    }

    // ---------------------------------------------------------------------
    // Config
    // ---------------------------------------------------------------------

    @Test
    @DisplayName("config is clamped and frozen on build")
    void testConfigClamp() {
        TheorySynthesizer.Config cfg = TheorySynthesizer.Config.defaults();
        cfg.formulaLimit = 99;
        cfg.modelLimit = 0;
        cfg.experimentLimit = 1;
        cfg.maxChars = -5;

        TheorySynthesizer s = TheorySynthesizer.builder().config(cfg).build();
        assertTrue(s.getConfig().isFrozen());
        assertEquals(FormulaSynthesizer.MAX_FORMULAS, s.getConfig().formulaLimit);
        assertEquals(1, s.getConfig().modelLimit);
        assertEquals(ExperimentRecommender.MIN_EXPERIMENTS, s.getConfig().experimentLimit);
        assertEquals(1, s.getConfig().maxChars);
    }

    @Test
    @DisplayName("compact config yields fewer formulas and one model")
    void testCompactConfig() {
        TheorySynthesizer s = TheorySynthesizer.builder().config(TheorySynthesizer.Config.compact()).build();
        TheorySynthesis t = s.synthesize(PARAGRAPH, text(PARAGRAPH));

        assertComplete(t);
        assertTrue(t.derivedFormulas.size() <= 3);
        assertEquals(1, t.systemModels.size());
    }
}
