package org.calista.theorysynth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class SystemModel {

    public final String name;
    public final String governingEquation;

    /** Short description of where the archetype applies. */
    public final String focus;

    @JsonCreator
    public SystemModel(@JsonProperty("name") String name,
                       @JsonProperty("governingEquation") String governingEquation,
                       @JsonProperty("focus") String focus) {
        this.name = Objects.requireNonNull(name, "name");
        this.governingEquation = Objects.requireNonNull(governingEquation, "governingEquation");
        this.focus = Objects.requireNonNull(focus, "focus");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SystemModel m)) return false;
        return name.equals(m.name) && governingEquation.equals(m.governingEquation) && focus.equals(m.focus);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, governingEquation, focus);
    }

    @Override
    public String toString() {
        return "SystemModel{" + name + ": " + governingEquation + '}';
    }
}
