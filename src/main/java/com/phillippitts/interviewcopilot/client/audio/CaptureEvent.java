package com.phillippitts.interviewcopilot.client.audio;

import com.phillippitts.interviewcopilot.domain.AudioChunk;
import com.phillippitts.interviewcopilot.exception.DeviceUnavailableException;

import java.time.Instant;

/**
 * Events emitted by an {@link AudioCaptureEngine} from its capture thread.
 */
public sealed interface CaptureEvent {

    /** A fixed-duration chunk; ownership passes to the receiver. */
    record ChunkCaptured(AudioChunk chunk) implements CaptureEvent { }

    /** Level of one analysis frame, 0-100. */
    record LevelSampled(double level) implements CaptureEvent { }

    /** Sustained silence crossed the configured duration. Raised once per silence interval. */
    record SilenceDetected(Instant at) implements CaptureEvent { }

    /** Capture stopped unexpectedly after the device was acquired. */
    record CaptureFailed(DeviceUnavailableException error) implements CaptureEvent { }
}
