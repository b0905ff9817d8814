package com.phillippitts.interviewcopilot.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Headless console client. Disabled unless {@code copilot.client.enabled=true}.
 *
 * <p>Endpoint and identity feed a per-session {@code SessionConfig}; nothing here is read
 * by the transport directly.
 *
 * @param enabled start the client on application startup
 * @param endpoint WebSocket URI of the session channel
 * @param userId identity sent on the handshake
 * @param profilePath JSON file holding the candidate profile
 * @param language recognizer language hint sent after connecting
 */
@Validated
@ConfigurationProperties(prefix = "copilot.client")
public record ClientProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("ws://localhost:8080/ws/session") @NotBlank String endpoint,
        @DefaultValue("local-user") @NotBlank String userId,
        @DefaultValue("profile.json") String profilePath,
        @DefaultValue("en") String language
) {
}
