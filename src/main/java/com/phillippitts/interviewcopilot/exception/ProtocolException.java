package com.phillippitts.interviewcopilot.exception;

/**
 * Thrown when a text frame is not a valid {@code {type, payload}} envelope or its payload
 * does not match the message type.
 */
public class ProtocolException extends InterviewCopilotException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
