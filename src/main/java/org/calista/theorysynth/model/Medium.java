package org.calista.theorysynth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Source medium the analyzed content was produced from.
 *
 * JSON form is the lowercase wire name ("text", "pdf", "audio").
 */
public enum Medium {
    TEXT("text"),
    PDF("pdf"),
    AUDIO("audio");

    private final String wireName;

    Medium(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses the wire name (case-insensitive, surrounding blanks ignored).
     *
     * @throws IllegalArgumentException for unknown or blank values
     */
    @JsonCreator
    public static Medium parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Medium is required");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (Medium m : values()) {
            if (m.wireName.equals(v)) return m;
        }
        throw new IllegalArgumentException("Unsupported medium: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
