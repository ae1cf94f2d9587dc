package org.calista.theorysynth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Metadata tag recording which source produced the analyzed content.
 * Echoes the descriptor verbatim; never derived from the content.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SignalProfile {

    public final Medium medium;
    public final String contextTag;
    public final List<String> additionalNotes;

    @JsonCreator
    public SignalProfile(@JsonProperty("medium") Medium medium,
                         @JsonProperty("contextTag") String contextTag,
                         @JsonProperty("additionalNotes") List<String> additionalNotes) {
        this.medium = Objects.requireNonNull(medium, "medium");
        this.contextTag = contextTag;
        this.additionalNotes = additionalNotes == null ? List.of() : List.copyOf(additionalNotes);
    }

    public static SignalProfile of(SourceDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        return new SignalProfile(descriptor.medium, descriptor.contextTag, descriptor.additionalNotes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignalProfile s)) return false;
        return medium == s.medium
                && Objects.equals(contextTag, s.contextTag)
                && additionalNotes.equals(s.additionalNotes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(medium, contextTag, additionalNotes);
    }

    @Override
    public String toString() {
        return "SignalProfile{medium=" + medium + '}';
    }
}
