package org.calista.theorysynth.synth;

import org.calista.theorysynth.model.Formula;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * FormulaSynthesizer: maps ranked concepts onto {@link FormulaTemplate}s.
 *
 * For each of the first {@code limit} concepts (rank order):
 *  - pick the unused catalog entry with the highest keyword overlap
 *    (ties, including "no overlap at all", go to the earliest declared entry)
 *  - once every catalog entry is used, fall back to {@link FormulaTemplate#GENERIC}
 *
 * Each catalog entry is used at most once and concepts are distinct, so no
 * template+concept pair repeats.
 */
public final class FormulaSynthesizer {

    /** Hard cap on derived formulas. */
    public static final int MAX_FORMULAS = 5;

    private final int limit;

    public FormulaSynthesizer() {
        this(MAX_FORMULAS);
    }

    public FormulaSynthesizer(int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1: " + limit);
        this.limit = Math.min(limit, MAX_FORMULAS);
    }

    public List<Formula> synthesize(List<Concept> concepts) {
        if (concepts == null || concepts.isEmpty()) return List.of();

        final int n = Math.min(limit, concepts.size());
        EnumSet<FormulaTemplate> used = EnumSet.noneOf(FormulaTemplate.class);
        ArrayList<Formula> out = new ArrayList<>(n);

        for (int i = 0; i < n; i++) {
            Concept c = concepts.get(i);
            FormulaTemplate t = choose(c, used);
            if (t != FormulaTemplate.GENERIC) used.add(t);

            out.add(new Formula(
                    t.render(t.title, c),
                    t.render(t.expression, c),
                    t.render(t.explanation, c)
            ));
        }
        return out;
    }

    static FormulaTemplate choose(Concept c, EnumSet<FormulaTemplate> used) {
        FormulaTemplate best = null;
        int bestScore = -1;
        for (FormulaTemplate t : FormulaTemplate.CATALOG) {
            if (used.contains(t)) continue;
            int score = t.overlap(c);
            if (score > bestScore) {
                best = t;
                bestScore = score;
            }
        }
        return best == null ? FormulaTemplate.GENERIC : best;
    }
}
