package org.calista.theorysynth.synth;

import java.text.Normalizer;
import java.util.Comparator;
import java.util.Objects;

/**
 * Concept: a salient term with its salience weight.
 *
 * Ranking: weight desc, then first occurrence asc, then term lexicographic.
 * The order is total, so sorting is deterministic.
 */
public final class Concept {

    /** Deterministic rank order. */
    public static final Comparator<Concept> RANKING = Comparator
            .comparingDouble((Concept c) -> c.weight).reversed()
            .thenComparingInt(c -> c.firstIndex)
            .thenComparing(c -> c.term);

    /** Normalized (lowercase, plural-folded) term. */
    public final String term;

    /** Salience, >= 0. */
    public final double weight;

    public final int frequency;

    /** Token index of the first occurrence (0-based). */
    public final int firstIndex;

    /** True for the fallback concept used when the input has no usable terms. */
    public final boolean synthetic;

    private final String symbol;

    public Concept(String term, double weight, int frequency, int firstIndex, boolean synthetic) {
        this.term = Objects.requireNonNull(term, "term");
        if (term.isBlank()) throw new IllegalArgumentException("term must not be blank");
        this.weight = (Double.isFinite(weight) && weight > 0.0) ? weight : 0.0;
        this.frequency = Math.max(0, frequency);
        this.firstIndex = Math.max(0, firstIndex);
        this.synthetic = synthetic;
        this.symbol = toSymbol(term);
    }

    public static Concept synthetic(String term) {
        return new Concept(term, 1.0, 0, 0, true);
    }

    /**
     * Identifier used inside formulas: accents stripped, letters/digits only,
     * never starts with a digit.
     */
    public String symbol() {
        return symbol;
    }

    static String toSymbol(String term) {
        String d = Normalizer.normalize(term, Normalizer.Form.NFD);
        StringBuilder b = new StringBuilder(d.length());
        for (int i = 0; i < d.length(); ) {
            int cp = d.codePointAt(i);
            i += Character.charCount(cp);
            if (Character.isLetter(cp) || Character.isDigit(cp)) b.appendCodePoint(cp);
        }
        if (b.length() == 0) return "x";
        if (Character.isDigit(b.codePointAt(0))) b.insert(0, "x");
        return b.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Concept c)) return false;
        return Double.compare(weight, c.weight) == 0
                && frequency == c.frequency
                && firstIndex == c.firstIndex
                && synthetic == c.synthetic
                && term.equals(c.term);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, weight, frequency, firstIndex, synthetic);
    }

    @Override
    public String toString() {
        return "Concept{" + term + ", w=" + weight + ", f=" + frequency + ", at=" + firstIndex
                + (synthetic ? ", synthetic" : "") + '}';
    }
}
