package org.calista.theorysynth.synth;

import org.calista.theorysynth.text.NormalizedText;

import java.util.List;
import java.util.Locale;

/**
 * Renders the core thesis from the top concepts and an original-case excerpt of the
 * first sentence that carries letters or digits.
 */
final class ThesisComposer {

    static final int MAX_EXCERPT = 160;

    String compose(NormalizedText text, List<Concept> concepts, List<SystemArchetype> archetypes) {
        String lead = concepts.get(0).term;
        String model = archetypes.get(0).displayName.toLowerCase(Locale.ROOT);

        StringBuilder b = new StringBuilder(256);
        if (concepts.size() > 1) {
            b.append(String.format(Locale.ROOT,
                    "A síntese propõe que %s e %s estruturam o conteúdo analisado, cuja dinâmica se aproxima do modelo de %s.",
                    lead, concepts.get(1).term, model));
        } else {
            b.append(String.format(Locale.ROOT,
                    "A síntese propõe que %s organiza o conteúdo analisado, cuja dinâmica se aproxima do modelo de %s.",
                    lead, model));
        }

        String excerpt = excerpt(text.sentences);
        if (!excerpt.isEmpty()) {
            b.append(" Trecho de referência: \"").append(excerpt).append("\"");
        }
        return b.toString();
    }

    static String excerpt(List<String> sentences) {
        for (String s : sentences) {
            if (!hasLetterOrDigit(s)) continue;
            if (s.length() <= MAX_EXCERPT) return s;
            int cut = MAX_EXCERPT;
            if (Character.isHighSurrogate(s.charAt(cut - 1))) cut--;
            int space = s.lastIndexOf(' ', cut);
            if (space > MAX_EXCERPT / 2) cut = space;
            return s.substring(0, cut).trim() + "…";
        }
        return "";
    }

    private static boolean hasLetterOrDigit(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isLetterOrDigit(s.charAt(i))) return true;
        }
        return false;
    }
}
