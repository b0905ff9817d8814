package com.phillippitts.interviewcopilot.domain;

import java.util.Objects;

/**
 * Fixed-duration slice of mono PCM16LE audio emitted by the capture engine.
 *
 * <p>Ownership passes to the transport on emission; chunks are never retained after
 * transmission or recognition.
 *
 * @param sequence monotonically increasing per capture run, starting at 0
 * @param capturedAtMillis epoch millis when the chunk was closed
 * @param sampleRate sample rate in Hz
 * @param pcm raw PCM16LE mono payload
 */
public record AudioChunk(long sequence, long capturedAtMillis, int sampleRate, byte[] pcm) {

    public AudioChunk {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0");
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
        Objects.requireNonNull(pcm, "pcm");
    }

    /** Duration represented by the payload, assuming 16-bit mono samples. */
    public long durationMillis() {
        return (pcm.length / 2L) * 1000L / sampleRate;
    }
}
