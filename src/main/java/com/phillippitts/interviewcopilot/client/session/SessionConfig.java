package com.phillippitts.interviewcopilot.client.session;

import com.phillippitts.interviewcopilot.config.properties.ClientProperties;

import java.net.URI;
import java.util.Objects;

/**
 * Per-session connection settings. Endpoint and user identity belong to one session, never to
 * the process: two sessions in the same JVM may talk to different servers as different users.
 *
 * @param endpoint WebSocket URI of the session endpoint
 * @param userId identity already established by the external identity provider
 * @param language recognizer language hint sent with {@code config}; may be null
 */
public record SessionConfig(URI endpoint, String userId, String language) {

    public SessionConfig {
        Objects.requireNonNull(endpoint, "endpoint");
        String scheme = endpoint.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Session endpoint must be a ws:// or wss:// URI: " + endpoint);
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
    }

    public static SessionConfig from(ClientProperties props) {
        return new SessionConfig(URI.create(props.endpoint()), props.userId(), props.language());
    }
}
