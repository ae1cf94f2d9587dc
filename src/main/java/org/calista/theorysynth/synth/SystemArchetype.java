package org.calista.theorysynth.synth;

import java.util.List;
import java.util.Map;

/**
 * Fixed catalog of system archetypes.
 *
 * {@code {s}} in the governing equation is replaced by the symbol of the concept that best
 * matches the archetype. {@link #COMPLEX_ADAPTIVE} is the declared default, returned when no
 * archetype overlaps the extracted concepts.
 */
public enum SystemArchetype {

    COUPLED_OSCILLATOR(
            "Osciladores acoplados",
            "∂²{s}/∂t² + γ·∂{s}/∂t + ω²·{s} = λ·(ξ − {s})",
            "ressonâncias e sincronização entre componentes periódicos",
            List.of("oscil", "vibra", "ciclo", "cycle", "period", "ritm", "rhythm", "frequen", "som", "sound",
                    "audio", "music", "pulso", "pulse", "resson", "reson", "onda", "wave", "acopl", "coupl"),
            Map.of(
                    "γ", "coeficiente de amortecimento",
                    "ω", "frequência natural",
                    "λ", "intensidade do acoplamento",
                    "ξ", "estado do oscilador vizinho"
            )
    ),

    DIFFUSIVE(
            "Sistema difusivo",
            "∂{s}/∂t = D·∇²{s} + S",
            "espalhamento gradual e gradientes de concentração no meio",
            List.of("difus", "diffus", "dispers", "espalh", "spread", "concentr", "calor", "heat", "transport",
                    "fluxo", "flow", "flux", "gradient", "temperat", "mistur"),
            Map.of(
                    "D", "coeficiente de difusão",
                    "S", "termo-fonte externo"
            )
    ),

    ADAPTIVE_NETWORK(
            "Rede adaptativa",
            "∂W[i,j]/∂t = η·{s}[i]·{s}[j] − δ·W[i,j]",
            "reforço e enfraquecimento de conexões entre agentes",
            List.of("rede", "network", "adapt", "aprend", "learn", "neur", "sinap", "synap", "conex", "connect",
                    "social", "agent", "plastic", "grafo", "graph"),
            Map.of(
                    "W", Glossary.COUPLING_MATRIX,
                    "η", "taxa de aprendizado",
                    "δ", "taxa de esquecimento"
            )
    ),

    FEEDBACK_CONTROL(
            "Controle por realimentação",
            "u = Kp·ε + Ki·∫ε dt, ε = {s}* − {s}",
            "estabilização em torno de um alvo por correção de erro",
            List.of("control", "regul", "feedback", "realiment", "estabil", "stabil", "equilibr", "homeost",
                    "ajust", "adjust", "meta", "goal", "erro", "error", "sensor"),
            Map.of(
                    "u", "sinal de controle aplicado",
                    "Kp", "ganho proporcional",
                    "Ki", "ganho integral",
                    "ε", "erro em relação ao alvo"
            )
    ),

    INFORMATION_CHANNEL(
            "Canal de informação",
            "C = B·log₂(1 + {s}/N)",
            "transmissão de sinal limitada por ruído e largura de banda",
            List.of("inform", "comunic", "communic", "canal", "channel", "sinal", "signal", "dado", "data",
                    "ruido", "noise", "mensag", "message", "codig", "code", "transmiss", "texto", "text", "lingu"),
            Map.of(
                    "C", "capacidade do canal",
                    "B", "largura de banda",
                    "N", "potência de ruído"
            )
    ),

    COMPLEX_ADAPTIVE(
            "Sistema adaptativo complexo",
            "∂{s}/∂t = F({s}, μ) + ζ(t)",
            "auto-organização e emergência a partir de interações locais",
            List.of("complex", "sistema", "system", "emerg", "organiz", "evolu", "caos", "chaos", "nonlinear",
                    "autonom", "hierarq", "hierarch"),
            Map.of(
                    "F", "campo de interações não lineares",
                    "μ", "parâmetros de controle externos",
                    "ζ", "flutuações estocásticas"
            )
    );

    public static final SystemArchetype DEFAULT = COMPLEX_ADAPTIVE;

    final String displayName;
    final String equation;
    final String focus;
    final List<String> keywords;
    final Map<String, String> parameters;

    SystemArchetype(String displayName, String equation, String focus,
                    List<String> keywords, Map<String, String> parameters) {
        this.displayName = displayName;
        this.equation = equation;
        this.focus = focus;
        this.keywords = keywords;
        this.parameters = parameters;
    }

    public String displayName() {
        return displayName;
    }

    public String focus() {
        return focus;
    }

    public List<String> keywords() {
        return keywords;
    }

    public Map<String, String> parameters() {
        return parameters;
    }

    String equationFor(Concept c) {
        return equation.replace("{s}", c.symbol());
    }
}
