package com.phillippitts.interviewcopilot.client.audio;

/**
 * Detects sustained silence from a stream of level samples.
 *
 * <p>Accumulates the duration of consecutive frames whose level is below the threshold. When the
 * accumulated duration reaches the configured minimum it fires once and disarms; it re-arms only
 * after a frame at or above the threshold. Prolonged silence therefore produces exactly one
 * signal, never a finalize per chunk.
 *
 * <p>Not thread-safe: fed only from the capture thread.
 */
public final class SilenceDetector {

    private final double threshold;
    private final long minSilenceMillis;

    private long silentMillis;
    private boolean armed = true;

    /**
     * @param threshold level (0-100) below which a frame counts as silent
     * @param minSilenceMillis sustained silence required to fire
     */
    public SilenceDetector(double threshold, long minSilenceMillis) {
        if (minSilenceMillis <= 0) {
            throw new IllegalArgumentException("minSilenceMillis must be positive");
        }
        this.threshold = threshold;
        this.minSilenceMillis = minSilenceMillis;
    }

    /**
     * Observes one analysis frame.
     *
     * @param level frame level, 0-100
     * @param frameMillis duration the frame covers
     * @return true exactly when this frame completes a silence interval
     */
    public boolean observe(double level, long frameMillis) {
        if (level >= threshold) {
            silentMillis = 0;
            armed = true;
            return false;
        }
        silentMillis += frameMillis;
        if (armed && silentMillis >= minSilenceMillis) {
            armed = false;
            silentMillis = 0;
            return true;
        }
        return false;
    }

    /** Forgets accumulated silence and re-arms (used on resume). */
    public void reset() {
        silentMillis = 0;
        armed = true;
    }

    public boolean isArmed() {
        return armed;
    }
}
