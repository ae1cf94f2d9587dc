package org.calista.theorysynth.text;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link TextNormalizer}: whitespace-collapsed text, original-case sentences and
 * lowercase tokens, plus how much of the raw input was kept.
 */
public final class NormalizedText {

    /** Collapsed (and possibly truncated) text, original case. */
    public final String text;

    /** Sentences in original case, in reading order. */
    public final List<String> sentences;

    /** Lowercase tokens in reading order. */
    public final List<String> tokens;

    /** Length of the raw input before truncation. */
    public final int originalLength;

    /** Number of raw characters actually processed. */
    public final int processedLength;

    public NormalizedText(String text, List<String> sentences, List<String> tokens,
                          int originalLength, int processedLength) {
        this.text = Objects.requireNonNull(text, "text");
        this.sentences = List.copyOf(Objects.requireNonNull(sentences, "sentences"));
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        this.originalLength = originalLength;
        this.processedLength = processedLength;
    }

    public boolean truncated() {
        return processedLength < originalLength;
    }

    public int tokenCount() {
        return tokens.size();
    }

    public int sentenceCount() {
        return sentences.size();
    }

    @Override
    public String toString() {
        return "NormalizedText{sentences=" + sentences.size()
                + ", tokens=" + tokens.size()
                + ", truncated=" + truncated()
                + '}';
    }
}
