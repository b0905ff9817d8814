package com.phillippitts.interviewcopilot.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Reconnect policy for the client-side session transport.
 *
 * <p>Delay for attempt {@code n} (1-based) is
 * {@code min(maxBackoffMs, initialBackoffMs * multiplier^(n-1))}.
 *
 * @param initialBackoffMs delay before the first reconnect attempt
 * @param maxBackoffMs cap on any single delay
 * @param multiplier growth factor between attempts
 * @param maxAttempts attempts before the disconnect is escalated to the user
 */
@Validated
@ConfigurationProperties(prefix = "copilot.transport")
public record TransportProperties(
        @DefaultValue("500") @Min(10) long initialBackoffMs,
        @DefaultValue("10000") @Min(10) long maxBackoffMs,
        @DefaultValue("2.0") @DecimalMin("1.0") double multiplier,
        @DefaultValue("8") @Min(1) int maxAttempts
) {
    public static TransportProperties defaults() {
        return new TransportProperties(500, 10_000, 2.0, 8);
    }
}
