package org.calista.theorysynth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * TheorySynthesis: the only artifact the synthesizer produces.
 *
 * Rules:
 * - allocated fresh per call, immutable afterwards (lists are unmodifiable copies)
 * - every list is non-empty for non-empty input
 * - scores are finite and within [0, 1]
 * - signalProfile.medium always equals the input descriptor's medium
 */
@JsonPropertyOrder({
        "coreThesis", "phenomena", "derivedFormulas", "systemModels", "parameterTable",
        "complexityScore", "coherence", "signalProfile", "inferenceSteps", "recommendedExperiments"
})
public final class TheorySynthesis {

    public final String coreThesis;
    public final List<String> phenomena;
    public final List<Formula> derivedFormulas;
    public final List<SystemModel> systemModels;
    public final List<ParameterEntry> parameterTable;
    public final double complexityScore;
    public final double coherence;
    public final SignalProfile signalProfile;
    public final List<String> inferenceSteps;
    public final List<String> recommendedExperiments;

    @JsonCreator
    public TheorySynthesis(@JsonProperty("coreThesis") String coreThesis,
                           @JsonProperty("phenomena") List<String> phenomena,
                           @JsonProperty("derivedFormulas") List<Formula> derivedFormulas,
                           @JsonProperty("systemModels") List<SystemModel> systemModels,
                           @JsonProperty("parameterTable") List<ParameterEntry> parameterTable,
                           @JsonProperty("complexityScore") double complexityScore,
                           @JsonProperty("coherence") double coherence,
                           @JsonProperty("signalProfile") SignalProfile signalProfile,
                           @JsonProperty("inferenceSteps") List<String> inferenceSteps,
                           @JsonProperty("recommendedExperiments") List<String> recommendedExperiments) {
        this.coreThesis = Objects.requireNonNull(coreThesis, "coreThesis");
        this.phenomena = List.copyOf(Objects.requireNonNull(phenomena, "phenomena"));
        this.derivedFormulas = List.copyOf(Objects.requireNonNull(derivedFormulas, "derivedFormulas"));
        this.systemModels = List.copyOf(Objects.requireNonNull(systemModels, "systemModels"));
        this.parameterTable = List.copyOf(Objects.requireNonNull(parameterTable, "parameterTable"));
        this.complexityScore = complexityScore;
        this.coherence = coherence;
        this.signalProfile = Objects.requireNonNull(signalProfile, "signalProfile");
        this.inferenceSteps = List.copyOf(Objects.requireNonNull(inferenceSteps, "inferenceSteps"));
        this.recommendedExperiments = List.copyOf(Objects.requireNonNull(recommendedExperiments, "recommendedExperiments"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TheorySynthesis t)) return false;
        return Double.compare(complexityScore, t.complexityScore) == 0
                && Double.compare(coherence, t.coherence) == 0
                && coreThesis.equals(t.coreThesis)
                && phenomena.equals(t.phenomena)
                && derivedFormulas.equals(t.derivedFormulas)
                && systemModels.equals(t.systemModels)
                && parameterTable.equals(t.parameterTable)
                && signalProfile.equals(t.signalProfile)
                && inferenceSteps.equals(t.inferenceSteps)
                && recommendedExperiments.equals(t.recommendedExperiments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coreThesis, phenomena, derivedFormulas, systemModels, parameterTable,
                complexityScore, coherence, signalProfile, inferenceSteps, recommendedExperiments);
    }

    @Override
    public String toString() {
        return "TheorySynthesis{phenomena=" + phenomena.size()
                + ", formulas=" + derivedFormulas.size()
                + ", models=" + systemModels.size()
                + ", params=" + parameterTable.size()
                + ", complexity=" + complexityScore
                + ", coherence=" + coherence
                + ", medium=" + signalProfile.medium
                + '}';
    }
}
