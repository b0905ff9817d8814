package com.phillippitts.interviewcopilot.client.audio;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Microphone capture for a live session.
 *
 * Contract:
 * - One active capture at a time; the device is held exclusively until {@link #stop()}
 * - Chunks are emitted at a fixed cadence regardless of speech, with sequence numbers from 0
 * - Audio is raw PCM (16kHz, 16-bit, mono, little-endian)
 * - Neither {@link #start} nor {@link #stop} blocks the caller on device latency
 */
public interface AudioCaptureEngine {

    /**
     * Acquires the microphone and starts emitting events to {@code events} from the capture thread.
     *
     * @return completes once the device is acquired, or exceptionally with
     *         {@link com.phillippitts.interviewcopilot.exception.DeviceUnavailableException}
     * @throws IllegalStateException if a capture is already active
     */
    CompletableFuture<Void> start(Consumer<? super CaptureEvent> events);

    /**
     * Stops reading, emits the buffered partial chunk, and releases the device.
     * Completes immediately when nothing is active.
     */
    CompletableFuture<Void> stop();

    /** Suspends chunk emission and silence detection without releasing the device. */
    void pause();

    /** Continues chunk emission after {@link #pause()}. */
    void resume();

    boolean isCapturing();

    boolean isPaused();

    /** Most recent level in [0, 100], independent of chunk payloads. */
    double currentLevel();
}
