package org.calista.theorysynth.text.impl;

import org.calista.theorysynth.text.Tokenizer;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * UnicodeTokenizer:
 * - Unicode normalization (NFKC) so composed/decomposed accents compare equal
 * - Lowercasing with Locale.ROOT
 * - Tokens are maximal runs of letters/digits; everything else is a boundary
 * - Over-long tokens are cut at maxTokenLength
 * - Single pass, no regex split
 */
public final class UnicodeTokenizer implements Tokenizer {

    public static final int DEFAULT_MAX_TOKEN_LEN = 64;

    private final int maxLen;

    public UnicodeTokenizer() {
        this(DEFAULT_MAX_TOKEN_LEN);
    }

    public UnicodeTokenizer(int maxTokenLength) {
        this.maxLen = Math.max(1, maxTokenLength);
    }

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();

        String s = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);

        ArrayList<String> out = new ArrayList<>(Math.max(4, s.length() / 6));
        StringBuilder tok = new StringBuilder(32);

        final int n = s.length();
        int i = 0;
        while (i < n) {
            int cp = s.codePointAt(i);
            int step = Character.charCount(cp);

            if (isTokenChar(cp)) {
                tok.appendCodePoint(cp);
            } else if (tok.length() > 0) {
                addToken(out, tok);
                tok.setLength(0);
            }
            i += step;
        }
        if (tok.length() > 0) addToken(out, tok);

        return out;
    }

    // ---- helpers ----

    private void addToken(List<String> out, CharSequence token) {
        int len = token.length();
        if (len > maxLen) {
            int cut = maxLen;
            if (Character.isHighSurrogate(token.charAt(cut - 1))) cut--;
            out.add(token.subSequence(0, Math.max(1, cut)).toString());
        } else {
            out.add(token.toString());
        }
    }

    private static boolean isTokenChar(int cp) {
        // combining marks stay inside the word (NFKC leaves a few uncomposed)
        int t = Character.getType(cp);
        return Character.isLetterOrDigit(cp)
                || t == Character.NON_SPACING_MARK
                || t == Character.COMBINING_SPACING_MARK;
    }
}
