package org.calista.theorysynth.synth;

import org.calista.theorysynth.model.Formula;
import org.calista.theorysynth.model.SystemModel;
import org.calista.theorysynth.text.NormalizedText;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * InferenceNarrator: renders the decisions already taken by the pipeline as
 * {@link #STEP_COUNT} ordered, human-readable steps. No computation happens here.
 */
public final class InferenceNarrator {

    public static final int STEP_COUNT = 5;

    private static final int TOP_TERMS = 3;

    public List<String> narrate(NormalizedText text,
                                List<Concept> concepts,
                                TextMetrics metrics,
                                List<SystemModel> models,
                                List<Formula> formulas) {
        ArrayList<String> steps = new ArrayList<>(STEP_COUNT);

        String truncation = text.truncated()
                ? String.format(Locale.ROOT, " (entrada limitada aos primeiros %d caracteres)", text.processedLength)
                : "";
        steps.add(String.format(Locale.ROOT,
                "Normalização do conteúdo: %d sentença(s) e %d token(s) analisados%s.",
                text.sentenceCount(), text.tokenCount(), truncation));

        steps.add(String.format(Locale.ROOT,
                "Extração de conceitos: %d conceito(s) ranqueado(s), com destaque para %s.",
                concepts.size(), topTerms(concepts)));

        steps.add(String.format(Locale.ROOT,
                "Métricas heurísticas: complexidade de %d%% e coerência de %d%%%s.",
                percent(metrics.complexityScore), percent(metrics.coherence),
                metrics.baseline ? " (valores de referência por falta de texto mensurável)" : ""));

        steps.add(String.format(Locale.ROOT,
                "Seleção de modelos de sistema: %s.", modelNames(models)));

        steps.add(String.format(Locale.ROOT,
                "Síntese simbólica: %d fórmula(s) derivada(s) a partir dos conceitos principais.",
                formulas.size()));

        return steps;
    }

    static int percent(double score) {
        return (int) Math.round(score * 100.0);
    }

    private static String topTerms(List<Concept> concepts) {
        StringJoiner j = new StringJoiner(", ");
        for (int i = 0; i < Math.min(TOP_TERMS, concepts.size()); i++) {
            j.add("\"" + concepts.get(i).term + "\"");
        }
        return j.toString();
    }

    private static String modelNames(List<SystemModel> models) {
        StringJoiner j = new StringJoiner(" e ");
        for (SystemModel m : models) j.add(m.name);
        return j.toString();
    }
}
