package org.calista.theorysynth.synth;

import org.calista.theorysynth.model.SystemModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * ExperimentRecommender: templated experiment suggestions.
 *
 * Order: for each model (selection order), its pairing with the first
 * {@link #PHENOMENA_PER_MODEL} phenomena. The list is capped at {@code limit}
 * and padded up to {@link #MIN_EXPERIMENTS} with controlled-replication suggestions.
 */
public final class ExperimentRecommender {

    public static final int MIN_EXPERIMENTS = 2;
    public static final int MAX_EXPERIMENTS = 4;

    static final int PHENOMENA_PER_MODEL = 2;

    private static final String OBSERVE = "Investigar experimentalmente %s observando %s.";
    private static final String REPLICATE = "Replicar %s em condições controladas variando a intensidade de %s.";
    private static final String REPLICATE_SERIES = "Replicar %s em condições controladas variando a intensidade de %s (série %d).";

    private final int limit;

    public ExperimentRecommender() {
        this(MAX_EXPERIMENTS);
    }

    public ExperimentRecommender(int limit) {
        this.limit = Math.max(MIN_EXPERIMENTS, Math.min(MAX_EXPERIMENTS, limit));
    }

    public List<String> recommend(List<SystemModel> models, List<String> phenomena, List<Concept> concepts) {
        ArrayList<String> out = new ArrayList<>(limit);
        final List<SystemModel> ms = models == null ? List.of() : models;
        final List<String> ps = phenomena == null ? List.of() : phenomena;

        outer:
        for (SystemModel m : ms) {
            for (int j = 0; j < Math.min(PHENOMENA_PER_MODEL, ps.size()); j++) {
                add(out, String.format(Locale.ROOT, OBSERVE, m.focus, asClause(ps.get(j))));
                if (out.size() >= limit) break outer;
            }
        }

        // pad with controlled replications; the series number keeps late candidates distinct
        final int cycle = Math.max(1, ms.size()) * Math.max(1, concepts == null ? 0 : concepts.size());
        for (int k = 0; out.size() < MIN_EXPERIMENTS; k++) {
            String focus = ms.isEmpty() ? SystemArchetype.DEFAULT.focus : ms.get(k % ms.size()).focus;
            String term = (concepts == null || concepts.isEmpty())
                    ? ConceptExtractor.FALLBACK_TERM
                    : concepts.get(k % concepts.size()).term;
            String candidate = k < cycle
                    ? String.format(Locale.ROOT, REPLICATE, focus, term)
                    : String.format(Locale.ROOT, REPLICATE_SERIES, focus, term, k - cycle + 2);
            add(out, candidate);
        }
        return out;
    }

    private static void add(List<String> out, String s) {
        if (!out.contains(s)) out.add(s);
    }

    /** "Correlação entre a e b." -> "correlação entre a e b" so it reads inside a sentence. */
    static String asClause(String phenomenon) {
        String s = phenomenon == null ? "" : phenomenon.trim();
        while (s.endsWith(".")) s = s.substring(0, s.length() - 1);
        if (s.isEmpty()) return s;
        int cp = s.codePointAt(0);
        return new StringBuilder(s.length())
                .appendCodePoint(Character.toLowerCase(cp))
                .append(s, Character.charCount(cp), s.length())
                .toString();
    }
}
