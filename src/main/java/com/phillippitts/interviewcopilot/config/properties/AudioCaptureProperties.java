package com.phillippitts.interviewcopilot.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture, chunking and silence detection.
 *
 * Required format (enforced by the capture engine): 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    static final int DEFAULT_CHUNK_MILLIS = 1000;
    static final int DEFAULT_LEVEL_WINDOW_MILLIS = 100;
    static final double DEFAULT_SILENCE_THRESHOLD = 5.0;
    static final int DEFAULT_SILENCE_DURATION_MS = 800;

    /** Interval at which chunks are emitted, regardless of speech or silence. */
    @Min(100)
    @Max(5000)
    private final int chunkMillis;

    /** Analysis frame for the level metric and silence evaluation. */
    @Min(10)
    @Max(500)
    private final int levelWindowMillis;

    /** Level (0-100) below which a frame counts as silence. */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private final double silenceThreshold;

    /** Sustained silence that raises a single SilenceDetected signal. */
    @Min(100)
    @Max(10_000)
    private final int silenceDurationMs;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    @ConstructorBinding
    public AudioCaptureProperties(Integer chunkMillis,
                                  Integer levelWindowMillis,
                                  Double silenceThreshold,
                                  Integer silenceDurationMs,
                                  String deviceName) {
        this.chunkMillis = chunkMillis != null ? chunkMillis : DEFAULT_CHUNK_MILLIS;
        this.levelWindowMillis = levelWindowMillis != null ? levelWindowMillis : DEFAULT_LEVEL_WINDOW_MILLIS;
        this.silenceThreshold = silenceThreshold != null ? silenceThreshold : DEFAULT_SILENCE_THRESHOLD;
        this.silenceDurationMs = silenceDurationMs != null ? silenceDurationMs : DEFAULT_SILENCE_DURATION_MS;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    /** Defaults for every field; used by tests and the headless client. */
    public static AudioCaptureProperties defaults() {
        return new AudioCaptureProperties(null, null, null, null, null);
    }

    public int getChunkMillis() { return chunkMillis; }
    public int getLevelWindowMillis() { return levelWindowMillis; }
    public double getSilenceThreshold() { return silenceThreshold; }
    public int getSilenceDurationMs() { return silenceDurationMs; }
    public String getDeviceName() { return deviceName; }
}
