package org.calista.theorysynth.ingest;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AudioSignalDescriber.
 */
class AudioSignalDescriberTest {

    private final AudioSignalDescriber describer = new AudioSignalDescriber();

    @Test
    @DisplayName("all parameters appear in fixed order")
    void testAllParameters() {
        String text = describer.describe(new AudioMetadata(1.0, 8000f, 128000.0));
        assertEquals("Transcrição analítica baseada em metadados do arquivo de áudio carregado."
                + " O sinal apresenta duração aproximada 1.00s, taxa de amostragem 8000 Hz, bitrate 128.0 kbps."
                + " A narrativa sugere investigar correlações fenomenológicas a partir do sinal capturado.", text);
    }

    @Test
    @DisplayName("missing parameters are skipped")
    void testPartial() {
        String text = describer.describe(new AudioMetadata(12.345, null, null));
        assertTrue(text.contains(" O sinal apresenta duração aproximada 12.35s."));
        assertFalse(text.contains("taxa de amostragem"));
    }

    @Test
    @DisplayName("empty metadata reports that no parameters were provided")
    void testEmpty() {
        String text = describer.describe(AudioMetadata.empty());
        assertTrue(text.contains("Parâmetros técnicos não fornecidos pelo arquivo."));
        assertFalse(text.contains("O sinal apresenta"));
        assertTrue(text.endsWith("a partir do sinal capturado."));
    }

    @Test
    @DisplayName("non-positive values count as not declared")
    void testNonPositive() {
        AudioMetadata md = new AudioMetadata(0.0, -1f, Double.NaN);
        assertTrue(md.isEmpty());
        assertEquals(AudioMetadata.empty(), md);
    }

    @Test
    @DisplayName("fractional sample rates keep their decimals")
    void testFormatRate() {
        assertEquals("44100", AudioSignalDescriber.formatRate(44100f));
        assertEquals("22050.5", AudioSignalDescriber.formatRate(22050.5f));
    }
}
