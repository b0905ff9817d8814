package com.phillippitts.interviewcopilot.client.transport;

import com.phillippitts.interviewcopilot.config.properties.TransportProperties;

import java.time.Duration;

/**
 * Capped exponential backoff for transport reconnects.
 *
 * <p>Attempts are 1-based: attempt {@code n} waits
 * {@code min(maxBackoff, initialBackoff * multiplier^(n-1))}. Once more than
 * {@code maxAttempts} attempts have failed the disconnect is escalated.
 */
public final class ReconnectPolicy {

    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final double multiplier;
    private final int maxAttempts;

    public ReconnectPolicy(TransportProperties props) {
        this.initialBackoffMs = props.initialBackoffMs();
        this.maxBackoffMs = Math.max(props.maxBackoffMs(), props.initialBackoffMs());
        this.multiplier = props.multiplier();
        this.maxAttempts = props.maxAttempts();
    }

    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double delay = initialBackoffMs * Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis((long) Math.min(maxBackoffMs, delay));
    }

    /** True when {@code attempt} is beyond the allowed number of attempts. */
    public boolean isExhausted(int attempt) {
        return attempt > maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
