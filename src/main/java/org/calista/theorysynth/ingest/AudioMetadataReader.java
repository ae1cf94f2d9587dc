package org.calista.theorysynth.ingest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads duration, sample rate and bitrate from an audio file header through Java Sound.
 *
 * Only headers are parsed; the signal itself is never decoded. Containers without an installed
 * Java Sound reader (mp3, ogg, ...) yield {@link AudioMetadata#empty()}.
 */
public final class AudioMetadataReader {

    private static final Logger log = LogManager.getLogger(AudioMetadataReader.class);

    /** Optional header property, microseconds (set by some providers). */
    static final String PROP_DURATION = "duration";
    /** Optional header property, bits per second. */
    static final String PROP_BITRATE = "bitrate";

    public AudioMetadata read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) throw new NoSuchFileException(file.toString());

        final AudioFileFormat aff;
        try {
            aff = AudioSystem.getAudioFileFormat(file.toFile());
        } catch (UnsupportedAudioFileException e) {
            log.warn("No audio reader for {}: {}", file.getFileName(), e.getMessage());
            return AudioMetadata.empty();
        }
        return fromFileFormat(aff);
    }

    static AudioMetadata fromFileFormat(AudioFileFormat aff) {
        AudioFormat fmt = aff.getFormat();

        Float sampleRate = specified(fmt.getSampleRate()) ? fmt.getSampleRate() : null;

        Double duration = null;
        Object micros = aff.getProperty(PROP_DURATION);
        if (micros instanceof Number) {
            duration = ((Number) micros).doubleValue() / 1_000_000.0;
        } else if (aff.getFrameLength() != AudioSystem.NOT_SPECIFIED && specified(fmt.getFrameRate())) {
            duration = aff.getFrameLength() / (double) fmt.getFrameRate();
        }

        Double bitrate = null;
        Object declared = aff.getProperty(PROP_BITRATE);
        if (declared instanceof Number) {
            bitrate = ((Number) declared).doubleValue();
        } else if (sampleRate != null
                && fmt.getSampleSizeInBits() != AudioSystem.NOT_SPECIFIED
                && fmt.getChannels() != AudioSystem.NOT_SPECIFIED) {
            // PCM: rate x depth x channels
            bitrate = sampleRate.doubleValue() * fmt.getSampleSizeInBits() * fmt.getChannels();
        }

        AudioMetadata md = new AudioMetadata(duration, sampleRate, bitrate);
        log.debug("Audio header: type={} {}", aff.getType(), md);
        return md;
    }

    private static boolean specified(float v) {
        return v != AudioSystem.NOT_SPECIFIED && v > 0f && !Float.isNaN(v);
    }
}
