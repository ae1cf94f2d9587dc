package org.calista.theorysynth.render;

import org.calista.theorysynth.model.Formula;
import org.calista.theorysynth.model.Medium;
import org.calista.theorysynth.model.ParameterEntry;
import org.calista.theorysynth.model.SystemModel;
import org.calista.theorysynth.model.TheorySynthesis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Markdown export of a {@link TheorySynthesis}. Lines are joined with '\n', no trailing newline.
 */
public final class TheoryMarkdownWriter {

    public static final String DEFAULT_FILE_NAME = "sintese-teorica.md";

    public String render(TheorySynthesis theory) {
        Objects.requireNonNull(theory, "theory");

        List<String> lines = new ArrayList<>(32);
        lines.add("# Núcleo Teórico");
        lines.add(theory.coreThesis);
        lines.add("");
        lines.add("## Fenômenos Principais");
        for (String item : theory.phenomena) lines.add("- " + item);
        lines.add("");
        lines.add("## Fórmulas Derivadas");
        for (Formula f : theory.derivedFormulas) {
            lines.add("### " + f.title);
            lines.add("- Expressão: " + f.expression);
            lines.add("- Explicação: " + f.explanation);
        }
        lines.add("");
        lines.add("## Modelos de Sistema");
        for (SystemModel m : theory.systemModels) {
            lines.add("- **" + m.name + "**: " + m.governingEquation);
            lines.add("  - Foco: " + m.focus);
        }
        lines.add("");
        lines.add("## Parâmetros");
        for (ParameterEntry p : theory.parameterTable) {
            lines.add("- " + p.label + ": " + p.description);
        }
        return String.join("\n", lines);
    }

    /** One-line header shown above the export: medium, complexity, coherence. */
    public String summary(TheorySynthesis theory) {
        Objects.requireNonNull(theory, "theory");
        return "Meio: " + mediumLabel(theory.signalProfile.medium)
                + " | Complexidade: " + percent(theory.complexityScore)
                + " | Coerência: " + percent(theory.coherence);
    }

    public static String mediumLabel(Medium medium) {
        switch (Objects.requireNonNull(medium, "medium")) {
            case TEXT: return "Texto";
            case PDF: return "PDF";
            case AUDIO: return "Áudio";
            default: throw new IllegalArgumentException("Unknown medium: " + medium);
        }
    }

    /** 0.424 -> "42%" */
    public static String percent(double score) {
        return String.format(Locale.ROOT, "%.0f%%", score * 100.0);
    }
}
