package org.calista.theorysynth.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns audio header metadata into the Portuguese narrative that stands in for a transcript.
 * No speech recognition happens anywhere: the text only reports what the header declares.
 */
public final class AudioSignalDescriber {

    /** Descriptor note attached to every audio-derived source. */
    public static final String SYNTHETIC_NOTE = "Transcrição sintética gerada via metadados.";

    static final String BASE = "Transcrição analítica baseada em metadados do arquivo de áudio carregado.";
    static final String NO_PARAMETERS = " Parâmetros técnicos não fornecidos pelo arquivo.";
    static final String CLOSING = " A narrativa sugere investigar correlações fenomenológicas a partir do sinal capturado.";

    public String describe(AudioMetadata md) {
        Objects.requireNonNull(md, "md");

        List<String> parts = new ArrayList<>(3);
        if (md.durationSeconds != null) {
            parts.add("duração aproximada " + String.format(Locale.ROOT, "%.2f", md.durationSeconds) + "s");
        }
        if (md.sampleRateHz != null) {
            parts.add("taxa de amostragem " + formatRate(md.sampleRateHz) + " Hz");
        }
        if (md.bitrateBps != null) {
            parts.add("bitrate " + String.format(Locale.ROOT, "%.1f", md.bitrateBps / 1000.0) + " kbps");
        }

        String metrics = parts.isEmpty()
                ? NO_PARAMETERS
                : " O sinal apresenta " + String.join(", ", parts) + ".";
        return BASE + metrics + CLOSING;
    }

    // 44100.0 -> "44100", 22050.5 -> "22050.5"
    static String formatRate(float hz) {
        if (hz == Math.rint(hz)) return Long.toString((long) hz);
        return Float.toString(hz);
    }
}
