package org.calista.theorysynth.synth;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * PhenomenonIdentifier: renders ranked concepts as phenomenon statements.
 *
 * Position i renders the adjacent pair (c[i], c[i+1]) with an interaction template, or c[i]
 * alone with a property template when it is the last concept. Templates rotate by position.
 * Output length is min(conceptCount, limit).
 */
public final class PhenomenonIdentifier {

    public static final int DEFAULT_LIMIT = 4;

    private static final String[] PAIR_TEMPLATES = {
            "Interação entre %s e %s sugere um acoplamento dinâmico",
            "%s modula a intensidade observada de %s",
            "Correlação persistente entre %s e %s ao longo do conteúdo",
            "%s atua como restrição estrutural sobre %s"
    };

    private static final String[] SINGLE_TEMPLATES = {
            "%s emerge como propriedade dominante do sistema",
            "%s se manifesta como variável de estado recorrente",
            "%s concentra a maior densidade de sinal do conteúdo",
            "%s delimita o regime de operação observado"
    };

    private final int limit;

    public PhenomenonIdentifier() {
        this(DEFAULT_LIMIT);
    }

    public PhenomenonIdentifier(int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1: " + limit);
        this.limit = limit;
    }

    public List<String> identify(List<Concept> concepts) {
        if (concepts == null || concepts.isEmpty()) return List.of();

        final int n = Math.min(concepts.size(), limit);
        ArrayList<String> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            String a = concepts.get(i).term;
            String sentence;
            if (i + 1 < concepts.size()) {
                String b = concepts.get(i + 1).term;
                sentence = String.format(Locale.ROOT, PAIR_TEMPLATES[i % PAIR_TEMPLATES.length], a, b);
            } else {
                sentence = String.format(Locale.ROOT, SINGLE_TEMPLATES[i % SINGLE_TEMPLATES.length], a);
            }
            out.add(capitalize(sentence) + ".");
        }
        return out;
    }

    static String capitalize(String s) {
        if (s == null || s.isEmpty()) return "";
        int cp = s.codePointAt(0);
        int upper = Character.toTitleCase(cp);
        if (upper == cp) return s;
        return new StringBuilder(s.length())
                .appendCodePoint(upper)
                .append(s, Character.charCount(cp), s.length())
                .toString();
    }
}
