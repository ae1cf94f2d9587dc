package org.calista.theorysynth.ingest;

import java.util.Objects;

/**
 * Technical parameters read from an audio file header. Any field may be null when the
 * container does not declare it.
 */
public final class AudioMetadata {

    private static final AudioMetadata EMPTY = new AudioMetadata(null, null, null);

    public final Double durationSeconds;
    public final Float sampleRateHz;
    public final Double bitrateBps;

    public AudioMetadata(Double durationSeconds, Float sampleRateHz, Double bitrateBps) {
        this.durationSeconds = positiveOrNull(durationSeconds);
        this.sampleRateHz = (sampleRateHz == null || !(sampleRateHz > 0f) || sampleRateHz.isInfinite()) ? null : sampleRateHz;
        this.bitrateBps = positiveOrNull(bitrateBps);
    }

    public static AudioMetadata empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return durationSeconds == null && sampleRateHz == null && bitrateBps == null;
    }

    // zero and NaN mean "not declared"
    private static Double positiveOrNull(Double v) {
        if (v == null || !(v > 0.0) || v.isInfinite()) return null;
        return v;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AudioMetadata)) return false;
        AudioMetadata that = (AudioMetadata) o;
        return Objects.equals(durationSeconds, that.durationSeconds)
                && Objects.equals(sampleRateHz, that.sampleRateHz)
                && Objects.equals(bitrateBps, that.bitrateBps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(durationSeconds, sampleRateHz, bitrateBps);
    }

    @Override
    public String toString() {
        return "AudioMetadata{durationSeconds=" + durationSeconds
                + ", sampleRateHz=" + sampleRateHz
                + ", bitrateBps=" + bitrateBps + '}';
    }
}
