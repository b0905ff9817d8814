package com.phillippitts.interviewcopilot.exception;

/**
 * Thrown when the session channel is closed and reconnection is exhausted or not possible.
 */
public class TransportDisconnectedException extends InterviewCopilotException {

    private final int attempts;

    public TransportDisconnectedException(String message) {
        super(message);
        this.attempts = 0;
    }

    public TransportDisconnectedException(String message, int attempts, Throwable cause) {
        super(message + " (attempts: " + attempts + ")", cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
