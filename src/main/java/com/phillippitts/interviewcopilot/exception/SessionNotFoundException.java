package com.phillippitts.interviewcopilot.exception;

/** Thrown when a lookup names a session that is not open (or never existed). */
public class SessionNotFoundException extends InterviewCopilotException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
