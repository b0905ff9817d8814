package com.phillippitts.interviewcopilot.exception;

/**
 * Thrown when answer generation fails. Always surfaced to the client as an error event and
 * never retried without an explicit {@code request_answer}.
 */
public class GenerationFailureException extends InterviewCopilotException {

    public static final String GENERATION_FAILED = "GENERATION_FAILED";
    public static final String GENERATION_TIMEOUT = "GENERATION_TIMEOUT";

    private final String reason;

    public GenerationFailureException(String message) {
        this(GENERATION_FAILED, message, null);
    }

    public GenerationFailureException(String message, Throwable cause) {
        this(GENERATION_FAILED, message, cause);
    }

    protected GenerationFailureException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /** Reason code carried on the wire ({@code GENERATION_FAILED} or {@code GENERATION_TIMEOUT}). */
    public String getReason() {
        return reason;
    }
}
