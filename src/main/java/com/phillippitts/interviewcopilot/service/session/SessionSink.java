package com.phillippitts.interviewcopilot.service.session;

import java.io.IOException;

/**
 * Outbound side of a session connection. Only the session's event loop calls {@link #send}.
 */
public interface SessionSink {

    void send(String text) throws IOException;

    boolean isOpen();
}
