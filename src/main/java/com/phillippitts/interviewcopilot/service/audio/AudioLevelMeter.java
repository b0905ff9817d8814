package com.phillippitts.interviewcopilot.service.audio;

/**
 * Computes a UI level metric from PCM16LE mono audio.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Decode 16-bit little-endian samples and normalise to [-1, 1]</li>
 *   <li>Compute RMS (Root Mean Square) over the window</li>
 *   <li>Scale to a 0-100 level: {@code min(100, rms * 200)}</li>
 * </ol>
 *
 * <p>A normal speaking voice lands roughly between 10 and 40; room noise stays under 5.
 *
 * @since 1.0
 */
public final class AudioLevelMeter {

    /** Full-scale amplitude of a signed 16-bit sample. */
    private static final double FULL_SCALE = 32768.0;

    /** Scale factor from normalised RMS to the 0-100 level. */
    private static final double LEVEL_SCALE = 200.0;

    private AudioLevelMeter() {
        // Utility class
    }

    /**
     * Level of the whole buffer.
     *
     * @param pcmData PCM16LE mono audio buffer
     * @return level in [0, 100]; 0 for null or empty input
     */
    public static double level(byte[] pcmData) {
        if (pcmData == null) {
            return 0;
        }
        return level(pcmData, 0, pcmData.length);
    }

    /**
     * Level of a window of the buffer.
     *
     * @param pcmData PCM16LE audio buffer
     * @param offset starting byte position
     * @param length number of bytes to analyse
     * @return level in [0, 100]
     */
    public static double level(byte[] pcmData, int offset, int length) {
        return Math.min(100.0, rms(pcmData, offset, length) * LEVEL_SCALE);
    }

    /**
     * Normalised RMS amplitude (0.0-1.0) for a window of PCM16LE samples.
     */
    static double rms(byte[] pcmData, int offset, int length) {
        if (pcmData == null || length < 2) {
            return 0;
        }
        double sumSquares = 0;
        int sampleCount = 0;

        for (int i = offset; i + 1 < offset + length && i + 1 < pcmData.length; i += 2) {
            // Little-endian: low byte first, high byte carries the sign
            int sample = (pcmData[i] & 0xFF) | (pcmData[i + 1] << 8);
            double normalised = sample / FULL_SCALE;
            sumSquares += normalised * normalised;
            sampleCount++;
        }

        if (sampleCount == 0) {
            return 0;
        }
        return Math.sqrt(sumSquares / sampleCount);
    }
}
