package com.phillippitts.interviewcopilot.client.audio;

import com.phillippitts.interviewcopilot.exception.DeviceUnavailableException;

import java.time.Instant;
import java.util.Objects;

/**
 * Application event for a microphone failure, published next to the
 * {@link CaptureEvent.CaptureFailed} the session sees.
 *
 * <p>{@code reason} is one of the {@link DeviceUnavailableException} reasons. {@code device} is the
 * configured input device name, or {@code "default"}. No audio is carried.
 */
public record CaptureErrorEvent(String reason, Phase phase, String device, long chunksEmitted, Instant at) {

    /** Where capture broke. */
    public enum Phase {
        /** The line could not be acquired; no audio was captured. */
        OPEN,
        /** The line failed after audio started flowing. */
        CAPTURE
    }

    public CaptureErrorEvent {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(at, "at");
        device = device == null ? "default" : device;
    }

    static CaptureErrorEvent of(DeviceUnavailableException e, Phase phase, String device, long chunksEmitted) {
        return new CaptureErrorEvent(e.getReason(), phase, device, chunksEmitted, Instant.now());
    }
}
