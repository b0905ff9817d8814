package com.phillippitts.interviewcopilot.exception;

import java.time.Duration;

/**
 * Generation did not finish within the configured timeout. A {@link GenerationFailureException}
 * with its own reason code.
 */
public class GenerationTimeoutException extends GenerationFailureException {

    private final Duration timeout;

    public GenerationTimeoutException(Duration timeout) {
        super(GENERATION_TIMEOUT, "Answer generation timed out after " + timeout.toMillis() + " ms", null);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
