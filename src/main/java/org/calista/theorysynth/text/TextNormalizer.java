package org.calista.theorysynth.text;

import org.calista.theorysynth.InvalidInputException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * TextNormalizer: first pipeline stage.
 *
 * Steps:
 *  1) cap the raw input at maxChars (length-based only, never splits a surrogate pair)
 *  2) collapse whitespace runs into single spaces
 *  3) split sentences after terminal punctuation (. ! ? …)
 *  4) tokenize the collapsed text
 *
 * Stateless; one instance can serve concurrent requests.
 */
public final class TextNormalizer {

    public static final int DEFAULT_MAX_CHARS = 20_000;

    private final Tokenizer tokenizer;
    private final int maxChars;

    public TextNormalizer(Tokenizer tokenizer) {
        this(tokenizer, DEFAULT_MAX_CHARS);
    }

    public TextNormalizer(Tokenizer tokenizer, int maxChars) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        if (maxChars < 1) throw new IllegalArgumentException("maxChars must be >= 1: " + maxChars);
        this.maxChars = maxChars;
    }

    public int maxChars() {
        return maxChars;
    }

    public NormalizedText normalize(String raw) {
        if (raw == null || raw.isBlank()) throw InvalidInputException.blankContent();

        int processed = capLength(raw, maxChars);
        String head = raw.substring(0, processed);
        String collapsed = collapseWhitespace(head);

        List<String> sentences = splitSentences(collapsed);
        List<String> tokens = tokenizer.tokenize(collapsed);

        return new NormalizedText(collapsed, sentences, tokens, raw.length(), processed);
    }

    // ---------------------------------------------------------------------
    // helpers
    // ---------------------------------------------------------------------

    static int capLength(String s, int max) {
        if (s.length() <= max) return s.length();
        int cut = max;
        if (Character.isHighSurrogate(s.charAt(cut - 1)) && Character.isLowSurrogate(s.charAt(cut))) cut--;
        return cut;
    }

    static String collapseWhitespace(String s) {
        StringBuilder b = new StringBuilder(s.length());
        boolean pendingSpace = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                pendingSpace = b.length() > 0;
                continue;
            }
            if (pendingSpace) {
                b.append(' ');
                pendingSpace = false;
            }
            b.append(c);
        }
        return b.toString();
    }

    static List<String> splitSentences(String collapsed) {
        ArrayList<String> out = new ArrayList<>();
        if (collapsed.isEmpty()) return out;

        StringBuilder cur = new StringBuilder(128);
        final int n = collapsed.length();
        for (int i = 0; i < n; i++) {
            char c = collapsed.charAt(i);
            cur.append(c);
            if (!isTerminal(c)) continue;

            // keep runs like "?!" or "..." attached to the same sentence
            while (i + 1 < n && isTerminal(collapsed.charAt(i + 1))) {
                cur.append(collapsed.charAt(++i));
            }
            if (i + 1 >= n || collapsed.charAt(i + 1) == ' ') {
                addSentence(out, cur);
                cur.setLength(0);
            }
        }
        addSentence(out, cur);
        return out;
    }

    private static void addSentence(List<String> out, StringBuilder cur) {
        String s = cur.toString().trim();
        if (!s.isEmpty()) out.add(s);
    }

    private static boolean isTerminal(char c) {
        return c == '.' || c == '!' || c == '?' || c == '…';
    }
}
