package com.phillippitts.interviewcopilot.service.recognition;

import com.phillippitts.interviewcopilot.config.properties.RecognizerProperties;
import com.phillippitts.interviewcopilot.domain.RecognitionResult;
import com.phillippitts.interviewcopilot.exception.InterviewCopilotException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Offline streaming recognizer backed by Vosk (JNI).
 *
 * <p>Each {@link org.vosk.Model} is loaded once and shared: the default one at startup, one per
 * configured language the first time a session asks for it. Each session gets its own
 * {@link org.vosk.Recognizer}, which is not thread-safe and is only fed from the session's
 * ordered queue.
 *
 * <p>Per chunk: {@code acceptWaveForm} returns true when Vosk closed an utterance, in which
 * case {@code getResult()} is the final text; otherwise {@code getPartialResult()} is the
 * current hypothesis. At a boundary {@code getFinalResult()} flushes the rest.
 */
@Component
@ConditionalOnProperty(name = "copilot.recognizer.provider", havingValue = "vosk")
public class VoskSpeechRecognizer implements SpeechRecognizer {

    private static final Logger LOG = LogManager.getLogger(VoskSpeechRecognizer.class);

    private final RecognizerProperties props;
    private final Object lock = new Object();
    // Keyed by model directory; the default model is loaded at startup, the others on first use
    private final Map<String, org.vosk.Model> models = new HashMap<>();
    private boolean closed;

    public VoskSpeechRecognizer(RecognizerProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    @PostConstruct
    void initialize() {
        synchronized (lock) {
            load(props.modelPath());
        }
        if (!props.languageModels().isEmpty()) {
            LOG.info("Additional Vosk models available on demand: languages={}", props.languageModels().keySet());
        }
    }

    @PreDestroy
    void close() {
        synchronized (lock) {
            closed = true;
            models.values().forEach(org.vosk.Model::close);
            if (!models.isEmpty()) {
                LOG.info("Vosk models released: count={}", models.size());
            }
            models.clear();
        }
    }

    @Override
    public RecognitionStream openStream(int sampleRate, String language) {
        String modelPath = props.modelPathFor(language);
        org.vosk.Model model;
        synchronized (lock) {
            if (closed) {
                throw new InterviewCopilotException("Vosk recognizer is closed");
            }
            model = models.containsKey(modelPath) ? models.get(modelPath) : load(modelPath);
        }
        try {
            org.vosk.Recognizer recognizer = new org.vosk.Recognizer(model, sampleRate);
            recognizer.setMaxAlternatives(props.maxAlternatives() > 1 ? props.maxAlternatives() : 0);
            LOG.debug("Vosk stream opened: language={}, model={}", language, modelPath);
            return new VoskStream(recognizer);
        } catch (IOException e) {
            throw new InterviewCopilotException("Failed to create Vosk recognizer", e);
        }
    }

    // Caller holds the lock
    private org.vosk.Model load(String modelPath) {
        if (!Files.isDirectory(Path.of(modelPath))) {
            throw new InterviewCopilotException("Vosk model not found at path: " + modelPath);
        }
        LOG.info("Loading Vosk model: modelPath={}, sampleRate={}", modelPath, props.sampleRate());
        try {
            org.vosk.Model model = new org.vosk.Model(modelPath);
            models.put(modelPath, model);
            LOG.info("Vosk model loaded: {}", modelPath);
            return model;
        } catch (IOException | RuntimeException | UnsatisfiedLinkError e) {
            throw new InterviewCopilotException("Failed to initialize Vosk: " + e.getMessage(), e);
        }
    }

    @Override
    public String name() {
        return "vosk";
    }

    @Override
    public boolean isHealthy() {
        synchronized (lock) {
            return !closed && models.containsKey(props.modelPath());
        }
    }

    private static final class VoskStream implements RecognitionStream {
        private final org.vosk.Recognizer recognizer;
        private boolean closed;

        VoskStream(org.vosk.Recognizer recognizer) {
            this.recognizer = recognizer;
        }

        @Override
        public Optional<RecognitionResult> accept(byte[] pcm) {
            if (closed || pcm.length == 0) {
                return Optional.empty();
            }
            boolean utteranceClosed = recognizer.acceptWaveForm(pcm, pcm.length);
            RecognitionResult result = utteranceClosed
                    ? VoskJsonParser.parseFinal(recognizer.getResult())
                    : VoskJsonParser.parsePartial(recognizer.getPartialResult());
            // An empty partial carries no information; an empty final still clears the segment
            if (!result.isFinal() && result.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(result);
        }

        @Override
        public RecognitionResult flush() {
            if (closed) {
                return RecognitionResult.finalResult("");
            }
            return VoskJsonParser.parseFinal(recognizer.getFinalResult());
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                recognizer.close();
            }
        }
    }
}
