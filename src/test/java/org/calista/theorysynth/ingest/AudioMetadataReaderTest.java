package org.calista.theorysynth.ingest;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AudioMetadataReader.
 */
class AudioMetadataReaderTest {

    @TempDir
    Path dir;

    /** One second of 16-bit mono silence at 8 kHz. */
    static Path writeWav(Path file) throws Exception {
        AudioFormat fmt = new AudioFormat(8000f, 16, 1, true, false);
        byte[] pcm = new byte[8000 * 2];
        try (AudioInputStream ais = new AudioInputStream(new ByteArrayInputStream(pcm), fmt, 8000)) {
            AudioSystem.write(ais, AudioFileFormat.Type.WAVE, file.toFile());
        }
        return file;
    }

    @Test
    @DisplayName("WAV header yields duration, sample rate and PCM bitrate")
    void testWav() throws Exception {
        Path wav = writeWav(dir.resolve("tom.wav"));

        AudioMetadata md = new AudioMetadataReader().read(wav);

        assertNotNull(md.durationSeconds);
        assertEquals(1.0, md.durationSeconds, 1e-6);
        assertEquals(8000f, md.sampleRateHz);
        assertEquals(128_000.0, md.bitrateBps, 1e-6);
    }

    @Test
    @DisplayName("files without an audio reader give empty metadata")
    void testUnsupported() throws Exception {
        Path junk = dir.resolve("notas.mp3");
        Files.write(junk, "isto não é áudio".getBytes(StandardCharsets.UTF_8));

        assertTrue(new AudioMetadataReader().read(junk).isEmpty());
    }

    @Test
    @DisplayName("missing files are reported")
    void testMissing() {
        assertThrows(NoSuchFileException.class, () -> new AudioMetadataReader().read(dir.resolve("nada.wav")));
    }
}
