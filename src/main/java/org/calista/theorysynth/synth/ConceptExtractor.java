package org.calista.theorysynth.synth;

import org.calista.theorysynth.text.Stopwords;
import org.calista.theorysynth.text.SuffixStemmer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * ConceptExtractor: ranks salient terms.
 *
 * Scoring:
 *  - tokens that are stopwords, shorter than {@link #MIN_TERM_LEN} or purely numeric are ignored
 *  - plural variants fold onto one key ({@link SuffixStemmer}); terms with the same
 *    {@link Concept#symbol()} (accent variants) count as one concept
 *  - weight = frequency * positionalBoost(firstIndex)
 *  - positionalBoost = 1 + 1 / (1 + firstIndex / POSITION_SCALE), strictly decreasing
 *
 * The top {@code limit} concepts are returned in {@link Concept#RANKING} order. When nothing
 * survives filtering a single synthetic concept ({@link #FALLBACK_TERM}) is returned instead.
 */
public final class ConceptExtractor {

    public static final int DEFAULT_LIMIT = 6;
    public static final int MIN_TERM_LEN = 3;
    public static final String FALLBACK_TERM = "sinal";

    static final double POSITION_SCALE = 10.0;

    private final int limit;

    public ConceptExtractor() {
        this(DEFAULT_LIMIT);
    }

    public ConceptExtractor(int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1: " + limit);
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }

    public List<Concept> extract(List<String> tokens) {
        // keyed by formula symbol, so "análise" and "analise" count as one concept;
        // insertion order == first occurrence order, the first surface form wins
        LinkedHashMap<String, Stat> stats = new LinkedHashMap<>();

        if (tokens != null) {
            for (int i = 0; i < tokens.size(); i++) {
                String tok = tokens.get(i);
                if (!isCandidate(tok)) continue;

                String key = SuffixStemmer.stem(tok);
                if (key.length() < MIN_TERM_LEN || Stopwords.isStopword(key)) continue;

                final int at = i;
                stats.computeIfAbsent(Concept.toSymbol(key), k -> new Stat(key, at)).count++;
            }
        }

        if (stats.isEmpty()) {
            return List.of(Concept.synthetic(FALLBACK_TERM));
        }

        ArrayList<Concept> all = new ArrayList<>(stats.size());
        for (Stat st : stats.values()) {
            all.add(new Concept(st.term, st.count * positionalBoost(st.first), st.count, st.first, false));
        }
        all.sort(Concept.RANKING);

        return List.copyOf(all.subList(0, Math.min(limit, all.size())));
    }

    private static final class Stat {
        final String term;
        final int first;
        int count;

        Stat(String term, int first) {
            this.term = term;
            this.first = first;
        }
    }

    static double positionalBoost(int firstIndex) {
        return 1.0 + 1.0 / (1.0 + Math.max(0, firstIndex) / POSITION_SCALE);
    }

    private static boolean isCandidate(String tok) {
        if (tok == null || tok.length() < MIN_TERM_LEN) return false;
        if (Stopwords.isStopword(tok)) return false;
        for (int i = 0; i < tok.length(); i++) {
            if (!Character.isDigit(tok.charAt(i))) return true;
        }
        return false;
    }
}
