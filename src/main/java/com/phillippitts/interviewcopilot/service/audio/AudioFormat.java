package com.phillippitts.interviewcopilot.service.audio;

/**
 * Audio format constants shared by capture, the binary frame codec, and recognition.
 *
 * <p>The whole pipeline runs on PCM 16 kHz, 16-bit signed, mono, little-endian.
 */
public final class AudioFormat {

    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    public static final int REQUIRED_CHANNELS = 1;

    public static final boolean REQUIRED_SIGNED = true;
    public static final boolean REQUIRED_BIG_ENDIAN = false;

    public static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;           // 32,000

    /** Format code carried in the binary frame header for PCM S16LE mono. */
    public static final byte FORMAT_PCM_S16LE_MONO = 1;

    private AudioFormat() {}

    /** Number of bytes holding {@code millis} of audio, aligned to whole samples. */
    public static int bytesFor(int millis) {
        return (int) ((long) millis * REQUIRED_SAMPLE_RATE / 1000L) * REQUIRED_BLOCK_ALIGN;
    }

    /** Creates the Java Sound format descriptor for capture lines. */
    public static javax.sound.sampled.AudioFormat toJavaSound() {
        return new javax.sound.sampled.AudioFormat(
                REQUIRED_SAMPLE_RATE,
                REQUIRED_BITS_PER_SAMPLE,
                REQUIRED_CHANNELS,
                REQUIRED_SIGNED,
                REQUIRED_BIG_ENDIAN
        );
    }
}
