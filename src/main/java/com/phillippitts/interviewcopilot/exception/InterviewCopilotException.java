package com.phillippitts.interviewcopilot.exception;

/**
 * Base exception for all interview copilot application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class InterviewCopilotException extends RuntimeException {

    public InterviewCopilotException(String message) {
        super(message);
    }

    public InterviewCopilotException(String message, Throwable cause) {
        super(message, cause);
    }
}
