package org.calista.theorysynth.synth;

/**
 * Text statistics and the two bounded scores derived from them.
 */
public final class TextMetrics {

    public final int totalTokens;
    public final int uniqueTokens;
    public final int sentenceCount;

    public final double vocabularyRichness;
    public final double averageSentenceLength;
    public final double conceptDensity;

    /** Variance of concept weights divided by the squared mean. */
    public final double weightDispersion;

    /** In [0, 1]. */
    public final double complexityScore;

    /** In [0, 1]. */
    public final double coherence;

    /** True when the baseline scores were substituted (too little text to measure). */
    public final boolean baseline;

    TextMetrics(int totalTokens,
                int uniqueTokens,
                int sentenceCount,
                double vocabularyRichness,
                double averageSentenceLength,
                double conceptDensity,
                double weightDispersion,
                double complexityScore,
                double coherence,
                boolean baseline) {
        this.totalTokens = totalTokens;
        this.uniqueTokens = uniqueTokens;
        this.sentenceCount = sentenceCount;
        this.vocabularyRichness = vocabularyRichness;
        this.averageSentenceLength = averageSentenceLength;
        this.conceptDensity = conceptDensity;
        this.weightDispersion = weightDispersion;
        this.complexityScore = complexityScore;
        this.coherence = coherence;
        this.baseline = baseline;
    }

    @Override
    public String toString() {
        return "TextMetrics{tokens=" + totalTokens
                + ", unique=" + uniqueTokens
                + ", sentences=" + sentenceCount
                + ", complexity=" + complexityScore
                + ", coherence=" + coherence
                + (baseline ? ", baseline" : "")
                + '}';
    }
}
