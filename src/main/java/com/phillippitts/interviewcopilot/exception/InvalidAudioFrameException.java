package com.phillippitts.interviewcopilot.exception;

/**
 * Thrown when a binary frame does not carry a valid audio header or payload
 * (bad magic, unsupported format, odd PCM length).
 */
public class InvalidAudioFrameException extends InterviewCopilotException {

    private final int frameSize;
    private final String reason;

    public InvalidAudioFrameException(int frameSize, String reason) {
        super("Invalid audio frame (" + frameSize + " bytes): " + reason);
        this.frameSize = frameSize;
        this.reason = reason;
    }

    public int getFrameSize() {
        return frameSize;
    }

    public String getReason() {
        return reason;
    }
}
