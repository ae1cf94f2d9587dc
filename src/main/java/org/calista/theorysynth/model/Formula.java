package org.calista.theorysynth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A symbolic formula derived from one concept.
 */
public final class Formula {

    public final String title;

    /** Symbolic expression; concept symbols appear as standalone identifiers. */
    public final String expression;

    public final String explanation;

    @JsonCreator
    public Formula(@JsonProperty("title") String title,
                   @JsonProperty("expression") String expression,
                   @JsonProperty("explanation") String explanation) {
        this.title = Objects.requireNonNull(title, "title");
        this.expression = Objects.requireNonNull(expression, "expression");
        this.explanation = Objects.requireNonNull(explanation, "explanation");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula f)) return false;
        return title.equals(f.title) && expression.equals(f.expression) && explanation.equals(f.explanation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, expression, explanation);
    }

    @Override
    public String toString() {
        return "Formula{" + title + ": " + expression + '}';
    }
}
