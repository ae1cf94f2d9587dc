package org.calista.theorysynth.synth;

import java.util.HashMap;
import java.util.Map;

/**
 * Descriptions of the fixed symbols declared by {@link FormulaTemplate} and {@link SystemArchetype}.
 *
 * A symbol declared by more than one catalog entry must carry the same description.
 */
final class Glossary {
    private Glossary() {}

    static final String COUPLING_MATRIX = "matriz de acoplamento entre nós";

    static final String CONCEPT_VARIABLE = "variável que representa %s";

    private static final Map<String, String> DECLARED = build();

    static String describe(String symbol) {
        return DECLARED.get(symbol);
    }

    static boolean isDeclared(String symbol) {
        return DECLARED.containsKey(symbol);
    }

    private static Map<String, String> build() {
        HashMap<String, String> m = new HashMap<>(64);
        for (FormulaTemplate t : FormulaTemplate.values()) putAll(m, t.parameters, t.name());
        for (SystemArchetype a : SystemArchetype.values()) putAll(m, a.parameters, a.name());
        return Map.copyOf(m);
    }

    private static void putAll(Map<String, String> into, Map<String, String> params, String owner) {
        for (Map.Entry<String, String> e : params.entrySet()) {
            String prev = into.putIfAbsent(e.getKey(), e.getValue());
            if (prev != null && !prev.equals(e.getValue())) {
                throw new IllegalStateException("Symbol " + e.getKey() + " declared twice with different meaning (" + owner + ")");
            }
        }
    }
}
