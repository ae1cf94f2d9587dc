package org.calista.theorysynth.synth;

import org.calista.theorysynth.model.SystemModel;

import java.util.ArrayList;
import java.util.List;

/**
 * SystemModelSelector: scores every {@link SystemArchetype} against the concept set.
 *
 * score = matched / (|keywords| + |concepts| - matched)   (Jaccard-style)
 * where matched counts the archetype keywords hit by at least one concept.
 *
 * The best {@code limit} archetypes with a positive score are returned (ties keep declaration
 * order). When nothing overlaps, the declared default archetype is returned alone.
 */
public final class SystemModelSelector {

    /** Hard cap on selected models. */
    public static final int MAX_MODELS = 2;

    private final int limit;

    public SystemModelSelector() {
        this(MAX_MODELS);
    }

    public SystemModelSelector(int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1: " + limit);
        this.limit = Math.min(limit, MAX_MODELS);
    }

    /** Archetypes chosen for the concept set, best first. Never empty. */
    public List<SystemArchetype> rank(List<Concept> concepts) {
        final List<Concept> cs = concepts == null ? List.of() : concepts;

        ArrayList<Scored> scored = new ArrayList<>();
        for (SystemArchetype a : SystemArchetype.values()) {
            double s = score(a, cs);
            if (s > 0.0) scored.add(new Scored(a, s));
        }
        // stable sort: equal scores keep declaration order
        scored.sort((x, y) -> Double.compare(y.score, x.score));

        ArrayList<SystemArchetype> out = new ArrayList<>(limit);
        for (Scored s : scored) {
            out.add(s.archetype);
            if (out.size() >= limit) break;
        }
        if (out.isEmpty()) out.add(SystemArchetype.DEFAULT);
        return out;
    }

    public List<SystemModel> select(List<Concept> concepts) {
        return toModels(rank(concepts), concepts);
    }

    public List<SystemModel> toModels(List<SystemArchetype> archetypes, List<Concept> concepts) {
        ArrayList<SystemModel> out = new ArrayList<>(archetypes.size());
        for (SystemArchetype a : archetypes) {
            Concept anchor = anchorConcept(a, concepts);
            out.add(new SystemModel(a.displayName, a.equationFor(anchor), a.focus));
        }
        return out;
    }

    static double score(SystemArchetype a, List<Concept> concepts) {
        if (concepts.isEmpty() || a.keywords.isEmpty()) return 0.0;

        int matched = 0;
        for (String k : a.keywords) {
            for (Concept c : concepts) {
                if (KeywordMatcher.matches(KeywordMatcher.fold(c), k)) {
                    matched++;
                    break;
                }
            }
        }
        if (matched == 0) return 0.0;
        double union = a.keywords.size() + concepts.size() - matched;
        return matched / union;
    }

    /** Highest-ranked concept with the best overlap; the top concept when none overlaps. */
    static Concept anchorConcept(SystemArchetype a, List<Concept> concepts) {
        if (concepts == null || concepts.isEmpty()) return Concept.synthetic(ConceptExtractor.FALLBACK_TERM);

        Concept best = concepts.get(0);
        int bestScore = 0;
        for (Concept c : concepts) {
            int s = KeywordMatcher.overlap(KeywordMatcher.fold(c), a.keywords);
            if (s > bestScore) {
                best = c;
                bestScore = s;
            }
        }
        return best;
    }

    private static final class Scored {
        final SystemArchetype archetype;
        final double score;

        Scored(SystemArchetype archetype, double score) {
            this.archetype = archetype;
            this.score = score;
        }
    }
}
