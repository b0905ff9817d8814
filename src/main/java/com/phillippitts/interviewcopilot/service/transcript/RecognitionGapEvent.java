package com.phillippitts.interviewcopilot.service.transcript;

import java.time.Instant;

/**
 * Dropped or out-of-order audio observed on a session. Degraded quality only; never retried.
 *
 * @param sessionId affected session
 * @param expectedSequence next sequence the server expected
 * @param receivedSequence sequence actually received
 * @param kind {@code GAP} when frames were skipped, {@code OUT_OF_ORDER} for stale frames
 * @param at observation time
 */
public record RecognitionGapEvent(String sessionId, long expectedSequence, long receivedSequence,
                                  Kind kind, Instant at) {

    public enum Kind { GAP, OUT_OF_ORDER }

    /** Number of frames missing (GAP) or behind (OUT_OF_ORDER). */
    public long distance() {
        return Math.abs(receivedSequence - expectedSequence);
    }
}
