package com.phillippitts.interviewcopilot.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.Locale;
import java.util.Map;

/**
 * Speech recognizer selection and Vosk model settings.
 *
 * @param provider {@code none} (no recognition, offline default) or {@code vosk}
 * @param modelPath path to the Vosk model directory
 * @param sampleRate recognizer sample rate; must match the capture format
 * @param maxAlternatives Vosk alternatives (1 keeps the plain result format)
 * @param languageModels extra Vosk model directories keyed by language code
 *        ({@code copilot.recognizer.language-models.de=models/vosk-model-small-de-0.15});
 *        languages without an entry use {@code modelPath}
 */
@Validated
@ConfigurationProperties(prefix = "copilot.recognizer")
public record RecognizerProperties(
        @DefaultValue("none") @NotBlank String provider,
        @DefaultValue("models/vosk-model-small-en-us-0.15")
        @NotBlank(message = "Vosk model path must not be blank") String modelPath,
        @DefaultValue("16000") @Positive(message = "Sample rate must be positive") int sampleRate,
        @DefaultValue("1") @Positive(message = "Max alternatives must be positive") int maxAlternatives,
        Map<String, String> languageModels
) {
    @ConstructorBinding
    public RecognizerProperties {
        languageModels = languageModels == null ? Map.of() : Map.copyOf(languageModels);
    }

    public RecognizerProperties(String provider, String modelPath, int sampleRate, int maxAlternatives) {
        this(provider, modelPath, sampleRate, maxAlternatives, Map.of());
    }

    public static RecognizerProperties defaults() {
        return new RecognizerProperties("none", "models/vosk-model-small-en-us-0.15", 16_000, 1);
    }

    /** Model directory for a language; the default model when none is configured for it. */
    public String modelPathFor(String language) {
        if (language == null || language.isBlank()) {
            return modelPath;
        }
        return languageModels.getOrDefault(language.strip().toLowerCase(Locale.ROOT), modelPath);
    }
}
