package com.phillippitts.interviewcopilot.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Fluent builder for {@link GenerationFailureException} with contextual metadata.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw GenerationFailureExceptionBuilder.create("Model call failed")
 *         .provider("http")
 *         .statusCode(503)
 *         .metadata("model", model)
 *         .cause(e)
 *         .build();
 * </pre>
 */
public final class GenerationFailureExceptionBuilder {

    private final String message;
    private String provider;
    private Integer statusCode;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private GenerationFailureExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static GenerationFailureExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new GenerationFailureExceptionBuilder(message);
    }

    public GenerationFailureExceptionBuilder provider(String provider) {
        this.provider = provider;
        return this;
    }

    /** HTTP status returned by the model endpoint, when there was one. */
    public GenerationFailureExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public GenerationFailureExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public GenerationFailureExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (provider={provider}, status={code}, {key1}={val1}, ...)
     * </pre>
     */
    public GenerationFailureException build() {
        return new GenerationFailureException(buildDetailedMessage(), cause);
    }

    private String buildDetailedMessage() {
        StringJoiner details = new StringJoiner(", ", message + " (", ")").setEmptyValue(message);
        if (provider != null) {
            details.add("provider=" + provider);
        }
        if (statusCode != null) {
            details.add("status=" + statusCode);
        }
        metadata.forEach((key, value) -> details.add(key + '=' + value));
        return details.toString();
    }
}
