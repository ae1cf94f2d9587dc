package org.calista.theorysynth;

import java.util.Objects;

/**
 * The only error the synthesizer signals: content that is null, empty or whitespace-only.
 * Ingestion reuses it for inputs that yield no analyzable text.
 *
 * Callers translate it into a user-facing message via {@link #kind()}; no partial result accompanies it.
 */
public final class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** Content handed to the synthesizer was null, empty or whitespace-only. */
        BLANK_CONTENT,
        /** A source was read but produced no text. */
        NOTHING_EXTRACTED,
        /** A source exists but its format cannot be read. */
        UNSUPPORTED_FORMAT
    }

    private final Kind kind;

    public InvalidInputException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static InvalidInputException blankContent() {
        return new InvalidInputException(Kind.BLANK_CONTENT, "content must not be empty or whitespace-only");
    }

    public Kind kind() {
        return kind;
    }
}
