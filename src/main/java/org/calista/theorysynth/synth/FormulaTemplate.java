package org.calista.theorysynth.synth;

import java.util.List;
import java.util.Map;

/**
 * Fixed catalog of formula templates.
 *
 * Placeholders: {@code {s}} is replaced by the concept symbol, {@code {t}} by the concept term.
 * Every symbol other than {@code {s}} that should reach the parameter table is declared in
 * {@link #parameters}. {@link #GENERIC} is the fallback and is never chosen by keyword.
 */
public enum FormulaTemplate {

    ENERGY(
            "Balanço energético de {t}",
            "E = ½·κ·{s}² + U({s})",
            "Trata {t} como coordenada generalizada: a energia total E soma um termo quadrático de rigidez κ ao potencial de interação U.",
            List.of("energ", "potenc", "power", "calor", "heat", "trabalh", "work", "forc", "massa", "mass",
                    "cinetic", "kinetic", "termic", "thermal", "entalp", "combust", "motor"),
            Map.of(
                    "E", "energia total associada ao sistema",
                    "κ", "constante de rigidez efetiva",
                    "U", "potencial de interação"
            )
    ),

    RATE(
            "Dinâmica de crescimento de {t}",
            "∂{s}/∂t = r·{s}·(1 − {s}/K)",
            "A variação temporal de {t} segue um crescimento logístico: r fixa a taxa intrínseca e K a capacidade de suporte.",
            List.of("taxa", "rate", "veloc", "speed", "cresc", "growth", "tempo", "time", "dinamic", "dynamic",
                    "evolu", "popula", "acelera", "mudanc", "change", "ritmo"),
            Map.of(
                    "r", "taxa intrínseca de crescimento",
                    "K", "capacidade de suporte"
            )
    ),

    FIELD(
            "Equação de campo para {t}",
            "∇²{s} − (1/c²)·∂²{s}/∂t² = −ρ",
            "{t} é tratado como um campo que se propaga com velocidade c a partir de uma densidade de fonte ρ.",
            List.of("campo", "field", "onda", "wave", "luz", "light", "eletr", "electr", "magnet", "gravit",
                    "espac", "space", "radia", "propag", "sinal", "signal", "optic"),
            Map.of(
                    "c", "velocidade de propagação",
                    "ρ", "densidade de fonte"
            )
    ),

    NETWORK(
            "Propagação em rede de {t}",
            "{s}[i](t+1) = σ(Σ W[i,j]·{s}[j](t) − θ)",
            "Cada nó i atualiza {t} a partir dos vizinhos j ponderados pela matriz W, com limiar θ e ativação σ.",
            List.of("rede", "network", "conex", "connect", "grafo", "graph", "social", "comunic", "interac",
                    "agent", "neur", "sinap", "synap", "link", "node"),
            Map.of(
                    "σ", "função de ativação",
                    "W", Glossary.COUPLING_MATRIX,
                    "θ", "limiar de ativação"
            )
    ),

    GENERIC(
            "Relação linear para {t}",
            "y = a·{s} + b",
            "Aproximação de primeira ordem: a resposta observável y varia linearmente com {t}, com sensibilidade a e termo de base b.",
            List.of(),
            Map.of(
                    "y", "resposta observável",
                    "a", "coeficiente de sensibilidade",
                    "b", "termo de base"
            )
    );

    final String title;
    final String expression;
    final String explanation;
    final List<String> keywords;
    final Map<String, String> parameters;

    FormulaTemplate(String title, String expression, String explanation,
                    List<String> keywords, Map<String, String> parameters) {
        this.title = title;
        this.expression = expression;
        this.explanation = explanation;
        this.keywords = keywords;
        this.parameters = parameters;
    }

    /** Keyword-selectable entries in declaration order (everything except GENERIC). */
    static final List<FormulaTemplate> CATALOG = List.of(ENERGY, RATE, FIELD, NETWORK);

    public List<String> keywords() {
        return keywords;
    }

    public Map<String, String> parameters() {
        return parameters;
    }

    int overlap(Concept c) {
        return KeywordMatcher.overlap(KeywordMatcher.fold(c), keywords);
    }

    String render(String pattern, Concept c) {
        return pattern.replace("{s}", c.symbol()).replace("{t}", c.term);
    }
}
