package org.calista.theorysynth.synth;

import java.util.List;
import java.util.Locale;

/**
 * Keyword overlap used by both catalogs.
 *
 * Keywords are ASCII stems ("energ", "difus") anchored at the start of the accent-free
 * concept symbol, so "cinética" matches "cinetic" but "algoritmo" does not match "ritm".
 * Keywords shorter than {@link #SHORT_KEYWORD} characters are whole words ("som", "meta") and
 * tolerate one trailing letter at most, so "sombra" and "metade" stay unmatched.
 * A short term also matches a longer keyword it prefixes ("rede" vs "redes").
 */
final class KeywordMatcher {
    private KeywordMatcher() {}

    static final int SHORT_KEYWORD = 5;

    static boolean matches(String foldedTerm, String keyword) {
        if (foldedTerm == null || keyword == null || foldedTerm.isEmpty() || keyword.isEmpty()) return false;
        if (foldedTerm.startsWith(keyword)) {
            return keyword.length() >= SHORT_KEYWORD || foldedTerm.length() <= keyword.length() + 1;
        }
        return foldedTerm.length() >= 4 && keyword.startsWith(foldedTerm);
    }

    /** Number of keywords matched by the term. */
    static int overlap(String foldedTerm, List<String> keywords) {
        int n = 0;
        for (String k : keywords) {
            if (matches(foldedTerm, k)) n++;
        }
        return n;
    }

    static String fold(Concept c) {
        return c.symbol().toLowerCase(Locale.ROOT);
    }
}
