package com.phillippitts.interviewcopilot.config;

import com.phillippitts.interviewcopilot.config.properties.AudioCaptureProperties;
import com.phillippitts.interviewcopilot.config.properties.RecognizerProperties;
import com.phillippitts.interviewcopilot.protocol.AudioFrameCodec;
import com.phillippitts.interviewcopilot.service.audio.AudioFormat;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;

/**
 * Cross-checks the configured recognizer against the fixed capture format at startup.
 *
 * <p>Clients always send {@link AudioFormat#REQUIRED_SAMPLE_RATE} frames and the session pipeline
 * rejects any frame whose rate differs from {@code copilot.recognizer.sample-rate}, so a mismatch
 * would turn every frame into an error envelope. Fail at boot instead.
 */
@Configuration
class AudioFormatConfig {
    private static final Logger LOG = LogManager.getLogger(AudioFormatConfig.class);

    private final RecognizerProperties recognizerProps;
    private final AudioCaptureProperties captureProps;

    AudioFormatConfig(RecognizerProperties recognizerProps, AudioCaptureProperties captureProps) {
        this.recognizerProps = recognizerProps;
        this.captureProps = captureProps;
    }

    @PostConstruct
    void checkRecognizerMatchesCapture() {
        if (recognizerProps.sampleRate() != AudioFormat.REQUIRED_SAMPLE_RATE) {
            throw new IllegalStateException(String.format(
                    "copilot.recognizer.sample-rate=%d does not match the capture format (%d Hz)",
                    recognizerProps.sampleRate(), AudioFormat.REQUIRED_SAMPLE_RATE));
        }
        int chunkBytes = AudioFormat.bytesFor(captureProps.getChunkMillis());
        LOG.info("Audio format: {} Hz, {}-bit, {} channel(s); chunk={} ms ({} B + {} B header, frame v{})",
                AudioFormat.REQUIRED_SAMPLE_RATE, AudioFormat.REQUIRED_BITS_PER_SAMPLE,
                AudioFormat.REQUIRED_CHANNELS, captureProps.getChunkMillis(), chunkBytes,
                AudioFrameCodec.HEADER_SIZE, AudioFrameCodec.VERSION);
    }
}
