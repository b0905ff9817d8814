package com.phillippitts.interviewcopilot.service.recognition;

import com.phillippitts.interviewcopilot.domain.RecognitionResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Recognizer that hears nothing. Keeps the pipeline runnable without a speech model:
 * audio is accepted and discarded, and {@code request_answer} still works.
 */
@Component
@ConditionalOnProperty(name = "copilot.recognizer.provider", havingValue = "none", matchIfMissing = true)
public class NoopSpeechRecognizer implements SpeechRecognizer {

    private static final Logger LOG = LogManager.getLogger(NoopSpeechRecognizer.class);

    public NoopSpeechRecognizer() {
        LOG.info("Speech recognition disabled (copilot.recognizer.provider=none); audio will be discarded");
    }

    @Override
    public RecognitionStream openStream(int sampleRate, String language) {
        return new RecognitionStream() {
            @Override
            public Optional<RecognitionResult> accept(byte[] pcm) {
                return Optional.empty();
            }

            @Override
            public RecognitionResult flush() {
                return RecognitionResult.finalResult("");
            }

            @Override
            public void close() {
                // nothing to release
            }
        };
    }

    @Override
    public String name() {
        return "none";
    }

    @Override
    public boolean isHealthy() {
        return true;
    }
}
