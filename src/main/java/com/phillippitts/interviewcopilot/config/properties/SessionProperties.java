package com.phillippitts.interviewcopilot.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Server-side session settings.
 *
 * @param endpointPath WebSocket path of the session channel
 * @param allowedOrigins comma-separated origin patterns accepted at handshake
 * @param maxSessions upper bound on concurrently open sessions
 * @param requireIdentity reject handshakes that carry no user identity
 */
@Validated
@ConfigurationProperties(prefix = "copilot.session")
public record SessionProperties(
        @DefaultValue("/ws/session") @NotBlank String endpointPath,
        @DefaultValue("*") @NotBlank String allowedOrigins,
        @DefaultValue("100") @Min(1) int maxSessions,
        @DefaultValue("false") boolean requireIdentity
) {
    public static SessionProperties defaults() {
        return new SessionProperties("/ws/session", "*", 100, false);
    }
}
