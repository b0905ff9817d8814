package com.phillippitts.interviewcopilot.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Answer generation settings.
 *
 * <p>{@code provider=template} composes answers offline from the selected context;
 * {@code provider=http} calls an OpenAI-compatible chat completions endpoint.
 */
@Validated
@ConfigurationProperties(prefix = "copilot.generation")
public record GenerationProperties(
        @DefaultValue("template") @NotBlank String provider,
        @DefaultValue("20000") @Min(100) @Max(300_000) long timeoutMs,
        @DefaultValue("2") @Min(1) @Max(10) int maxStories,
        @DefaultValue("0.6") @DecimalMin("0.0") @DecimalMax("1.0") double qaMatchThreshold,
        @DefaultValue("https://api.openai.com/v1") String baseUrl,
        String apiKey,
        @DefaultValue("gpt-4o-mini") String model,
        @DefaultValue("600") @Min(16) int maxTokens,
        @DefaultValue("0.7") @DecimalMin("0.0") @DecimalMax("2.0") double temperature
) {
    public static GenerationProperties defaults() {
        return new GenerationProperties("template", 20_000, 2, 0.6,
                "https://api.openai.com/v1", null, "gpt-4o-mini", 600, 0.7);
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }
}
