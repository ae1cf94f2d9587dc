package org.calista.theorysynth.text;

/**
 * Light plural-folding for Portuguese and English so that singular/plural variants share one key.
 *
 * This is not a real stemmer: only plural endings are touched, and the result is always a
 * readable word ("sinais" -> "sinal", "fatores" -> "fator", "variáveis" -> "variável",
 * "análises" -> "análise", "theories" -> "theory").
 * Tokens shorter than 4 characters are returned unchanged.
 */
public final class SuffixStemmer {
    private SuffixStemmer() {}

    private static final int MIN_STEM = 3;

    public static String stem(String token) {
        if (token == null) return "";
        String t = token;
        int n = t.length();
        if (n < 4) return t;

        if (t.endsWith("ções")) return t.substring(0, n - 4) + "ção";
        if (t.endsWith("ões") || t.endsWith("ães")) return t.substring(0, n - 3) + "ão";
        if (t.endsWith("éis")) return keep(t, n - 3, "el");
        if (t.endsWith("eis") && n > 4 && !isVowel(t.charAt(n - 4))) return keep(t, n - 3, "el");
        if (t.endsWith("ais") && n > 4) return keep(t, n - 3, "al");
        // English only: "espécies" must become "espécie"
        if (t.endsWith("ies") && n > 4 && isAscii(t)) return keep(t, n - 3, "y");
        if (t.endsWith("sses")) return t.substring(0, n - 2);

        // never strip words that end in a non-plural s
        if (t.endsWith("ss") || t.endsWith("us") || t.endsWith("is")) return t;

        // singular without final e: "fatores", "luzes", "boxes"
        if (t.endsWith("es") && n > 4 && dropsEs(t, n)) return keep(t, n - 2, "");
        if (t.endsWith("s")) return keep(t, n - 1, "");
        return t;
    }

    private static boolean dropsEs(String t, int n) {
        char before = t.charAt(n - 3);
        char prev = t.charAt(n - 4);
        switch (before) {
            case 'r': return prev == 'a' || prev == 'e' || prev == 'o';
            case 'z': return prev != 'i';
            case 'x': return true;
            default: return false;
        }
    }

    private static boolean isVowel(char c) {
        return "aeiouáéíóúâêôãõà".indexOf(c) >= 0;
    }

    private static boolean isAscii(String t) {
        for (int i = 0; i < t.length(); i++) {
            if (t.charAt(i) > 0x7f) return false;
        }
        return true;
    }

    private static String keep(String t, int cut, String suffix) {
        if (cut < MIN_STEM) return t;
        return t.substring(0, cut) + suffix;
    }
}
