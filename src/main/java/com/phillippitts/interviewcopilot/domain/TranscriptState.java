package com.phillippitts.interviewcopilot.domain;

/**
 * Point-in-time view of a session transcript.
 *
 * @param currentSegment most recent unconfirmed recognizer output (may be revised)
 * @param accumulatedText confirmed text since the last question boundary
 */
public record TranscriptState(String currentSegment, String accumulatedText) {
    public static final TranscriptState EMPTY = new TranscriptState("", "");

    public TranscriptState {
        currentSegment = currentSegment == null ? "" : currentSegment;
        accumulatedText = accumulatedText == null ? "" : accumulatedText;
    }
}
