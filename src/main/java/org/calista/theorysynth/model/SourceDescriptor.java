package org.calista.theorysynth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SourceDescriptor: what the ingestion side knows about the content it hands over.
 *
 * Immutable; built once per request by the caller.
 * - medium: where the text came from
 * - length: character count of the extracted content (>= 0)
 * - contextTag: optional opaque label (usually the original filename)
 * - additionalNotes: optional ordered annotations
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SourceDescriptor {

    public final Medium medium;
    public final int length;
    public final String contextTag;
    public final List<String> additionalNotes;

    @JsonCreator
    public SourceDescriptor(@JsonProperty("medium") Medium medium,
                            @JsonProperty("length") int length,
                            @JsonProperty("contextTag") String contextTag,
                            @JsonProperty("additionalNotes") List<String> additionalNotes) {
        this.medium = Objects.requireNonNull(medium, "medium");
        if (length < 0) throw new IllegalArgumentException("length must be >= 0: " + length);
        this.length = length;
        this.contextTag = (contextTag == null || contextTag.isBlank()) ? null : contextTag.trim();
        this.additionalNotes = copyNotes(additionalNotes);
    }

    public static SourceDescriptor of(Medium medium, int length) {
        return new SourceDescriptor(medium, length, null, List.of());
    }

    /** Descriptor for plain text, length taken from the content itself. */
    public static SourceDescriptor forText(String content) {
        return of(Medium.TEXT, content == null ? 0 : content.length());
    }

    public SourceDescriptor withContextTag(String tag) {
        return new SourceDescriptor(medium, length, tag, additionalNotes);
    }

    public SourceDescriptor withNote(String note) {
        ArrayList<String> notes = new ArrayList<>(additionalNotes);
        notes.add(note);
        return new SourceDescriptor(medium, length, contextTag, notes);
    }

    private static List<String> copyNotes(List<String> notes) {
        if (notes == null || notes.isEmpty()) return List.of();
        ArrayList<String> out = new ArrayList<>(notes.size());
        for (String n : notes) {
            if (n == null || n.isBlank()) continue;
            out.add(n.trim());
        }
        return List.copyOf(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceDescriptor d)) return false;
        return length == d.length
                && medium == d.medium
                && Objects.equals(contextTag, d.contextTag)
                && additionalNotes.equals(d.additionalNotes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(medium, length, contextTag, additionalNotes);
    }

    @Override
    public String toString() {
        return "SourceDescriptor{medium=" + medium
                + ", length=" + length
                + (contextTag == null ? "" : ", contextTag=" + contextTag)
                + ", notes=" + additionalNotes.size()
                + '}';
    }
}
