package org.calista.theorysynth.synth;

import org.calista.theorysynth.model.Formula;
import org.calista.theorysynth.model.ParameterEntry;
import org.calista.theorysynth.model.SystemModel;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ParameterTableBuilder.
 */
class ParameterTableBuilderTest {

    private final ParameterTableBuilder builder = new ParameterTableBuilder();

    private static List<String> labels(List<ParameterEntry> entries) {
        List<String> out = new ArrayList<>();
        for (ParameterEntry e : entries) out.add(e.label);
        return out;
    }

    @Test
    @DisplayName("symbols are collected in first-appearance order, formulas before models")
    void testOrder() {
        List<Concept> cs = List.of(new Concept("energia", 4.0, 2, 0, false));
        List<Formula> formulas = new FormulaSynthesizer().synthesize(cs);
        List<SystemModel> models = new SystemModelSelector().select(cs);

        List<ParameterEntry> table = builder.build(formulas, models, cs);

        assertEquals(List.of("E", "κ", "energia", "U", "F", "μ", "ζ"), labels(table));
        assertEquals("energia total associada ao sistema", table.get(0).description);
        assertEquals("variável que representa energia", table.get(2).description);
    }

    @Test
    @DisplayName("a symbol shared by a formula and a model appears once")
    void testDeduplication() {
        List<Concept> cs = List.of(new Concept("rede", 4.0, 2, 0, false));
        List<Formula> formulas = new FormulaSynthesizer().synthesize(cs);
        List<SystemModel> models = new SystemModelSelector().select(cs);

        List<String> labels = labels(builder.build(formulas, models, cs));
        assertEquals(1, labels.stream().filter("W"::equals).count());
        assertEquals(1, labels.stream().filter("rede"::equals).count());
        assertFalse(labels.contains("i"));
        assertFalse(labels.contains("t"));
    }

    @Test
    @DisplayName("every label occurs literally in a scanned expression")
    void testClosure() {
        List<Concept> cs = new ConceptExtractor().extract(List.of(
            "campo", "rede", "sinal", "oscilação", "controle", "taxa", "energia", "fluxo"));
        List<Formula> formulas = new FormulaSynthesizer().synthesize(cs);
        List<SystemModel> models = new SystemModelSelector().select(cs);

        StringBuilder all = new StringBuilder();
        for (Formula f : formulas) all.append(f.expression).append('\n');
        for (SystemModel m : models) all.append(m.governingEquation).append('\n');

        List<ParameterEntry> table = builder.build(formulas, models, cs);
        assertFalse(table.isEmpty());
        for (ParameterEntry e : table) {
            assertTrue(all.indexOf(e.label) >= 0, "label not found: " + e.label);
        }
    }

    @Test
    @DisplayName("unknown identifiers are skipped")
    void testUnknownSkipped() {
        List<ParameterEntry> table = builder.build(
            List.of(new Formula("t", "z = q + log(v)", "x")), List.of(), List.of());
        assertTrue(table.isEmpty());
    }
}
