package org.calista.theorysynth.synth;

import org.calista.theorysynth.text.NormalizedText;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * MetricEngine: bounded complexity/coherence heuristics.
 *
 * complexity = clamp(W_RICHNESS * unique/total
 *                  + W_SENTENCE * asl / (asl + SENTENCE_SCALE)
 *                  + W_DENSITY  * min(1, concepts/total), 0, 1)
 *
 * coherence  = clamp(1 - v / (1 + v), 0, 1), v = var(conceptWeights) / mean(conceptWeights)^2
 *
 * Both terms of complexity grow with their input; coherence falls as weights spread out.
 * With totalTokens <= 1 nothing is measurable and the baselines are returned.
 */
public final class MetricEngine {

    public static final double W_RICHNESS = 0.45;
    public static final double W_SENTENCE = 0.35;
    public static final double W_DENSITY = 0.20;

    /** Average sentence length (tokens) at which the sentence term reaches half its range. */
    public static final double SENTENCE_SCALE = 20.0;

    public static final double BASELINE_COMPLEXITY = 0.25;
    public static final double BASELINE_COHERENCE = 0.5;

    public TextMetrics measure(NormalizedText text, List<Concept> concepts) {
        Objects.requireNonNull(text, "text");
        final List<Concept> cs = concepts == null ? List.of() : concepts;

        final int total = text.tokenCount();
        final int unique = new HashSet<>(text.tokens).size();
        final int sentences = text.sentenceCount();

        if (total <= 1) {
            return new TextMetrics(total, unique, sentences,
                    0.0, 0.0, 0.0, 0.0,
                    BASELINE_COMPLEXITY, BASELINE_COHERENCE, true);
        }

        double richness = (double) unique / total;
        double asl = (double) total / Math.max(1, sentences);
        double density = Math.min(1.0, (double) cs.size() / total);
        double dispersion = dispersion(cs);

        double complexity = complexityScore(richness, asl, density);
        double coherence = coherenceScore(dispersion);

        return new TextMetrics(total, unique, sentences,
                richness, asl, density, dispersion,
                complexity, coherence, false);
    }

    static double complexityScore(double richness, double averageSentenceLength, double density) {
        double raw = W_RICHNESS * richness
                + W_SENTENCE * normalizeSentenceLength(averageSentenceLength)
                + W_DENSITY * density;
        return clamp01(raw, BASELINE_COMPLEXITY);
    }

    static double coherenceScore(double dispersion) {
        if (!Double.isFinite(dispersion) || dispersion < 0.0) return BASELINE_COHERENCE;
        return clamp01(1.0 - dispersion / (1.0 + dispersion), BASELINE_COHERENCE);
    }

    static double normalizeSentenceLength(double asl) {
        if (!(asl > 0.0) || !Double.isFinite(asl)) return 0.0;
        return asl / (asl + SENTENCE_SCALE);
    }

    /** Scale-free spread of the concept weights; 0 for fewer than two concepts. */
    static double dispersion(List<Concept> concepts) {
        if (concepts.size() < 2) return 0.0;

        double sum = 0.0;
        for (Concept c : concepts) sum += c.weight;
        double mean = sum / concepts.size();
        if (!(mean > 0.0)) return 0.0;

        double sq = 0.0;
        for (Concept c : concepts) {
            double d = c.weight - mean;
            sq += d * d;
        }
        double variance = sq / concepts.size();
        return variance / (mean * mean);
    }

    static double clamp01(double v, double fallback) {
        if (!Double.isFinite(v)) return fallback;
        if (v < 0.0) return 0.0;
        if (v > 1.0) return 1.0;
        return v;
    }
}
