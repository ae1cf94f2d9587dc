package org.calista.theorysynth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class ParameterEntry {

    /** Symbol exactly as it appears in an expression or governing equation. */
    public final String label;
    public final String description;

    @JsonCreator
    public ParameterEntry(@JsonProperty("label") String label,
                          @JsonProperty("description") String description) {
        this.label = Objects.requireNonNull(label, "label");
        this.description = Objects.requireNonNull(description, "description");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterEntry p)) return false;
        return label.equals(p.label) && description.equals(p.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, description);
    }

    @Override
    public String toString() {
        return label + ": " + description;
    }
}
