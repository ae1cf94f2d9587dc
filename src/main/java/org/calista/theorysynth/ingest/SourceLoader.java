package org.calista.theorysynth.ingest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.theorysynth.InvalidInputException;
import org.calista.theorysynth.io.FileIO;
import org.calista.theorysynth.model.Medium;
import org.calista.theorysynth.model.SourceDescriptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * SourceLoader: turns a user-supplied input into {@link LoadedSource} per medium.
 *
 * - text:  file content as-is (or inline text via {@link #fromText})
 * - pdf:   text already extracted from a PDF; binary PDF files are rejected
 * - audio: header metadata rendered by {@link AudioSignalDescriber}
 *
 * File inputs carry their file name as context tag. Missing files surface as
 * {@link NoSuchFileException}; inputs that yield no content as {@link InvalidInputException}.
 */
public final class SourceLoader {

    private static final Logger log = LogManager.getLogger(SourceLoader.class);

    static final String PDF_MAGIC = "%PDF-";

    private final FileIO io;
    private final AudioMetadataReader audioReader;
    private final AudioSignalDescriber audioDescriber;

    public SourceLoader(FileIO io) {
        this(io, new AudioMetadataReader(), new AudioSignalDescriber());
    }

    public SourceLoader(FileIO io, AudioMetadataReader audioReader, AudioSignalDescriber audioDescriber) {
        this.io = Objects.requireNonNull(io, "io");
        this.audioReader = Objects.requireNonNull(audioReader, "audioReader");
        this.audioDescriber = Objects.requireNonNull(audioDescriber, "audioDescriber");
    }

    /** Inline text, no file involved. */
    public LoadedSource fromText(String raw) {
        if (raw == null || raw.isBlank()) throw InvalidInputException.blankContent();
        String content = raw;
        return new LoadedSource(content, SourceDescriptor.forText(content));
    }

    public LoadedSource load(Medium medium, Path file) throws IOException {
        Objects.requireNonNull(medium, "medium");
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) throw new NoSuchFileException(file.toString());

        String tag = file.getFileName() == null ? null : file.getFileName().toString();
        LoadedSource out;
        switch (medium) {
            case TEXT: {
                String content = requireContent(io.readString(file), tag);
                out = new LoadedSource(content, SourceDescriptor.of(Medium.TEXT, content.length()).withContextTag(tag));
                break;
            }
            case PDF: {
                String content = requireContent(readExtractedPdfText(file), tag);
                out = new LoadedSource(content, SourceDescriptor.of(Medium.PDF, content.length()).withContextTag(tag));
                break;
            }
            case AUDIO: {
                String content = requireContent(audioDescriber.describe(audioReader.read(file)), tag);
                out = new LoadedSource(content, SourceDescriptor.of(Medium.AUDIO, content.length())
                        .withContextTag(tag)
                        .withNote(AudioSignalDescriber.SYNTHETIC_NOTE));
                break;
            }
            default:
                throw new IllegalArgumentException("Unsupported medium: " + medium);
        }

        log.debug("Loaded {}", out);
        return out;
    }

    private String readExtractedPdfText(Path file) throws IOException {
        String name = String.valueOf(file.getFileName()).toLowerCase(Locale.ROOT);
        if (name.endsWith(".pdf")) {
            throw new InvalidInputException(InvalidInputException.Kind.UNSUPPORTED_FORMAT,
                    "binary PDF files are not supported, provide the extracted text: " + file);
        }
        String text = io.readString(file);
        if (text.startsWith(PDF_MAGIC)) {
            throw new InvalidInputException(InvalidInputException.Kind.UNSUPPORTED_FORMAT,
                    "file looks like a binary PDF, provide the extracted text: " + file);
        }
        return text;
    }

    private static String requireContent(String content, String what) {
        if (content == null || content.isBlank()) {
            throw new InvalidInputException(InvalidInputException.Kind.NOTHING_EXTRACTED,
                    "no content could be extracted from " + what);
        }
        return content;
    }
}
