package com.phillippitts.interviewcopilot.util;

import java.time.Duration;

/**
 * Centralized timeout constants for threads and channels owned by the application.
 *
 * <p>Configurable timeouts (generation, reconnect backoff) live in the typed properties;
 * the values here guard shutdown paths where a hard upper bound is enough.
 *
 * @since 1.0
 */
public final class Timeouts {

    /** Maximum time to wait for the capture thread during application shutdown. */
    public static final Duration CAPTURE_THREAD_SHUTDOWN_TIMEOUT = Duration.ofSeconds(1);

    /** Time limit for a single outbound WebSocket message on the server side. */
    public static final Duration WEBSOCKET_SEND_TIME_LIMIT = Duration.ofSeconds(10);

    /** Buffer limit for queued outbound WebSocket messages per session (bytes). */
    public static final int WEBSOCKET_SEND_BUFFER_LIMIT = 512 * 1024;

    /** Connect timeout for the client-side WebSocket handshake. */
    public static final Duration TRANSPORT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private Timeouts() {
        // Utility class - prevent instantiation
    }
}
