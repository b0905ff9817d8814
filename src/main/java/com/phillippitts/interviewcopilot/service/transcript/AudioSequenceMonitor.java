package com.phillippitts.interviewcopilot.service.transcript;

import java.time.Instant;
import java.util.Optional;

/**
 * Tracks audio frame sequence numbers for one session.
 *
 * <p>The first frame seen sets the baseline, so a client that reconnects mid-run (and keeps
 * counting) does not report a gap. Frames behind the expected sequence are stale and must be
 * discarded by the caller; frames ahead of it are accepted and the skipped range is reported.
 *
 * <p>Not thread-safe: called only from the session's ordered queue.
 */
public final class AudioSequenceMonitor {

    /** Outcome of observing one frame. */
    public record Observation(boolean accept, Optional<RecognitionGapEvent> gap) {}

    private final String sessionId;
    private long expected = -1;

    public AudioSequenceMonitor(String sessionId) {
        this.sessionId = sessionId;
    }

    public Observation observe(long sequence) {
        if (expected < 0 || sequence == expected) {
            expected = sequence + 1;
            return new Observation(true, Optional.empty());
        }
        if (sequence > expected) {
            RecognitionGapEvent gap = new RecognitionGapEvent(sessionId, expected, sequence,
                    RecognitionGapEvent.Kind.GAP, Instant.now());
            expected = sequence + 1;
            return new Observation(true, Optional.of(gap));
        }
        RecognitionGapEvent stale = new RecognitionGapEvent(sessionId, expected, sequence,
                RecognitionGapEvent.Kind.OUT_OF_ORDER, Instant.now());
        return new Observation(false, Optional.of(stale));
    }

    /** Forgets the baseline; the next frame starts a new run. */
    public void reset() {
        expected = -1;
    }
}
