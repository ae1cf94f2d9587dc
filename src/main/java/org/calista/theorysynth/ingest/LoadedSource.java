package org.calista.theorysynth.ingest;

import org.calista.theorysynth.model.SourceDescriptor;

import java.util.Objects;

/** Extracted content together with the descriptor the synthesizer receives. */
public final class LoadedSource {

    public final String content;
    public final SourceDescriptor descriptor;

    public LoadedSource(String content, SourceDescriptor descriptor) {
        this.content = Objects.requireNonNull(content, "content");
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    }

    @Override
    public String toString() {
        return "LoadedSource{" + descriptor + ", chars=" + content.length() + '}';
    }
}
