package com.phillippitts.interviewcopilot.client.session;

/** Connection half of the client session state. */
public enum ConnectionState {
    IDLE,
    /** Initial connect or a reconnect attempt in progress. */
    CONNECTING,
    STREAMING
}
