package com.phillippitts.interviewcopilot.client.session;

/**
 * Processing half of the client session state, driven only by server events.
 */
public enum ProcessingState {
    IDLE,
    TRANSCRIBING,
    DETECTING,
    GENERATING;

    /** States an error returns to. */
    boolean isStable() {
        return this == IDLE || this == TRANSCRIBING;
    }
}
