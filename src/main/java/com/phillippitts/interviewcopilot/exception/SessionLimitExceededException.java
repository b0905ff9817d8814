package com.phillippitts.interviewcopilot.exception;

/** Thrown when a new connection would exceed {@code copilot.session.max-sessions}. */
public class SessionLimitExceededException extends InterviewCopilotException {

    private final int limit;

    public SessionLimitExceededException(int limit) {
        super("Session limit reached: " + limit);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
