package com.phillippitts.interviewcopilot.service.session;

import com.phillippitts.interviewcopilot.config.properties.RecognizerProperties;
import com.phillippitts.interviewcopilot.domain.AnswerRecord;
import com.phillippitts.interviewcopilot.domain.AudioChunk;
import com.phillippitts.interviewcopilot.domain.ContextPayload;
import com.phillippitts.interviewcopilot.domain.QuestionEvent;
import com.phillippitts.interviewcopilot.domain.QuestionType;
import com.phillippitts.interviewcopilot.domain.RecognitionResult;
import com.phillippitts.interviewcopilot.domain.TranscriptState;
import com.phillippitts.interviewcopilot.exception.GenerationFailureException;
import com.phillippitts.interviewcopilot.exception.InvalidAudioFrameException;
import com.phillippitts.interviewcopilot.exception.ProtocolException;
import com.phillippitts.interviewcopilot.protocol.AudioFrameCodec;
import com.phillippitts.interviewcopilot.protocol.Envelope;
import com.phillippitts.interviewcopilot.protocol.EnvelopeCodec;
import com.phillippitts.interviewcopilot.protocol.ErrorCode;
import com.phillippitts.interviewcopilot.protocol.MessageType;
import com.phillippitts.interviewcopilot.protocol.Payloads;
import com.phillippitts.interviewcopilot.service.context.ContextStore;
import com.phillippitts.interviewcopilot.service.detection.QuestionBoundaryDetector;
import com.phillippitts.interviewcopilot.service.detection.QuestionClassifier;
import com.phillippitts.interviewcopilot.service.events.GenerationFailedEvent;
import com.phillippitts.interviewcopilot.service.generation.AnswerGenerator;
import com.phillippitts.interviewcopilot.service.generation.GenerationHandle;
import com.phillippitts.interviewcopilot.service.metrics.SessionMetrics;
import com.phillippitts.interviewcopilot.service.recognition.RecognitionStream;
import com.phillippitts.interviewcopilot.service.recognition.SpeechRecognizer;
import com.phillippitts.interviewcopilot.service.transcript.AudioSequenceMonitor;
import com.phillippitts.interviewcopilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Server-side pipeline of a live session: audio → transcript → question boundary → answer.
 *
 * <p><b>Ordering:</b> every inbound message (audio frame, {@code context}, {@code finalize},
 * {@code request_answer}, {@code clear}, {@code config}) is queued on the session's ordered queue
 * and handled one at a time in arrival order. Generation completions re-enter the same queue, so
 * an answer can never race a {@code clear} or a boundary of the same session. Different sessions
 * run in parallel on the shared session pool.
 *
 * <p><b>Audio:</b> frames are decoded, checked against the expected sequence, fed to the
 * session's recognizer and dropped. Gaps surface as {@code status: degraded}; stale frames are
 * discarded. Nothing is retransmitted and no audio is retained.
 *
 * <p><b>Boundary:</b> {@code finalize} flushes the recognizer, freezes the transcript, and runs
 * the detector exactly once. A detected question starts one generation; otherwise the session
 * returns to {@code idle}. A failing detector restores the transcript intact.
 *
 * <p><b>Answers:</b> while the model writes, fragments go out as {@code answer_chunk} events
 * straight from the generation worker. They are all published before the result completes, so
 * the {@code answer} always follows the last fragment of its question. Fragments stop as soon as
 * a generation times out or is cancelled.
 *
 * <p><b>Close:</b> cancels in-flight generations, discards queued work and undelivered events,
 * and releases the recognizer. No answer is delivered after close.
 */
@Service
public class SessionPipeline {

    private static final Logger LOG = LogManager.getLogger(SessionPipeline.class);

    private final SpeechRecognizer recognizer;
    private final QuestionBoundaryDetector detector;
    private final AnswerGenerator generator;
    private final EnvelopeCodec codec;
    private final SessionRegistry registry;
    private final SessionMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final RecognizerProperties recognizerProps;
    private final Executor sessionExecutor;

    public SessionPipeline(SpeechRecognizer recognizer,
                           QuestionBoundaryDetector detector,
                           AnswerGenerator generator,
                           EnvelopeCodec codec,
                           SessionRegistry registry,
                           SessionMetrics metrics,
                           ApplicationEventPublisher publisher,
                           RecognizerProperties recognizerProps,
                           @Qualifier("sessionExecutor") Executor sessionExecutor) {
        this.recognizer = Objects.requireNonNull(recognizer);
        this.detector = Objects.requireNonNull(detector);
        this.generator = Objects.requireNonNull(generator);
        this.codec = Objects.requireNonNull(codec);
        this.registry = Objects.requireNonNull(registry);
        this.metrics = Objects.requireNonNull(metrics);
        this.publisher = Objects.requireNonNull(publisher);
        this.recognizerProps = Objects.requireNonNull(recognizerProps);
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor);
    }

    /**
     * Opens a session for an accepted connection and acknowledges it with {@code status: connected}.
     *
     * @throws com.phillippitts.interviewcopilot.exception.SessionLimitExceededException if the
     *         session limit is reached
     */
    public LiveSession open(String sessionId, String userId, SessionSink sink) {
        Objects.requireNonNull(sink, "sink");
        RecognitionStream stream = recognizer.openStream(recognizerProps.sampleRate(), null);
        LiveSession session = new LiveSession(sessionId, userId, stream, sessionExecutor,
                event -> send(sessionId, sink, event));
        try {
            registry.register(session);
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }
        metrics.sessionOpened();
        LOG.info("Session opened: id={}, userId={}, recognizer={}", sessionId, userId, recognizer.name());
        session.emit(SessionEvent.status(Payloads.Status.CONNECTED, sessionId));
        return session;
    }

    /** Handles one binary audio frame. */
    public void onAudioFrame(LiveSession session, ByteBuffer frame) {
        int frameSize = frame.remaining();
        AudioChunk chunk;
        try {
            chunk = AudioFrameCodec.decode(frame);
            if (chunk.sampleRate() != recognizerProps.sampleRate()) {
                throw new InvalidAudioFrameException(frameSize,
                        "sample rate " + chunk.sampleRate() + " does not match " + recognizerProps.sampleRate());
            }
        } catch (InvalidAudioFrameException e) {
            LOG.warn("Rejected audio frame: session={}, size={}, reason={}",
                    session.id(), e.getFrameSize(), e.getReason());
            session.submit(() -> emitError(session, ErrorCode.INVALID_AUDIO, e.getMessage(), null));
            return;
        }
        session.submit(() -> ingestAudio(session, chunk));
    }

    /** Handles one text envelope. */
    public void onTextMessage(LiveSession session, String text) {
        Envelope envelope;
        try {
            envelope = codec.decode(text);
            if (envelope.type().direction() != MessageType.Direction.CLIENT_TO_SERVER) {
                throw new ProtocolException("Unexpected message type from client: " + envelope.type().wireName());
            }
        } catch (ProtocolException e) {
            LOG.warn("Rejected message: session={}, reason={}", session.id(), e.getMessage());
            session.submit(() -> emitError(session, ErrorCode.PROTOCOL_ERROR, e.getMessage(), null));
            return;
        }
        session.submit(() -> dispatch(session, envelope));
    }

    /**
     * Closes a session. Idempotent.
     */
    public void close(LiveSession session, String reason) {
        int cancelled = session.close();
        if (cancelled < 0) {
            return;
        }
        registry.remove(session.id());
        metrics.sessionClosed();
        LOG.info("Session closed: id={}, reason={}, answers={}, cancelledGenerations={}",
                session.id(), reason, session.answers().size(), cancelled);
    }

    private void dispatch(LiveSession session, Envelope envelope) {
        try {
            switch (envelope.type()) {
                case CONTEXT -> updateContext(session, codec.payload(envelope, ContextPayload.class));
                case REQUEST_ANSWER -> requestAnswer(session, codec.payload(envelope, Payloads.RequestAnswer.class));
                case FINALIZE -> finalizeBoundary(session);
                case CLEAR -> clear(session);
                case CONFIG -> configure(session, codec.payload(envelope, Payloads.Config.class));
                default -> throw new ProtocolException("Unsupported message type: " + envelope.type().wireName());
            }
        } catch (ProtocolException e) {
            LOG.warn("Rejected {} message: session={}, reason={}",
                    envelope.type().wireName(), session.id(), e.getMessage());
            emitError(session, ErrorCode.PROTOCOL_ERROR, e.getMessage(), null);
        }
    }

    private void ingestAudio(LiveSession session, AudioChunk chunk) {
        AudioSequenceMonitor.Observation observation = session.sequenceMonitor().observe(chunk.sequence());
        observation.gap().ifPresent(gap -> {
            metrics.recognitionGap(gap.kind().name().toLowerCase(Locale.ROOT));
            publisher.publishEvent(gap);
            session.emit(SessionEvent.status(Payloads.Status.DEGRADED,
                    gap.kind().name().toLowerCase(Locale.ROOT) + ": expected " + gap.expectedSequence()
                            + ", received " + gap.receivedSequence()));
        });
        if (!observation.accept()) {
            return;
        }
        Optional<RecognitionResult> result = session.recognize(chunk.pcm());
        result.ifPresent(r -> applyRecognition(session, r));
    }

    private void applyRecognition(LiveSession session, RecognitionResult result) {
        TranscriptState state = session.transcript().apply(result);
        String text = result.isFinal() ? result.text() : state.currentSegment();
        session.emit(new SessionEvent.TranscriptionUpdated(
                new Payloads.Transcription(text, state.accumulatedText(), result.isFinal())));
    }

    private void finalizeBoundary(LiveSession session) {
        RecognitionResult flushed = session.flushRecognition();
        if (!flushed.isEmpty()) {
            applyRecognition(session, flushed);
        }

        String snapshot = session.transcript().beginBoundary();
        session.emit(SessionEvent.status(Payloads.Status.DETECTING, null));

        Optional<QuestionEvent> question;
        try {
            question = detector.detect(snapshot);
        } catch (RuntimeException e) {
            session.transcript().abortBoundary();
            LOG.error("Question detection failed; transcript restored: session={}", session.id(), e);
            emitError(session, ErrorCode.INTERNAL_ERROR, "Question detection failed", null);
            return;
        }
        session.transcript().completeBoundary();

        if (question.isEmpty()) {
            metrics.boundaryWithoutQuestion();
            session.emit(SessionEvent.status(Payloads.Status.IDLE, "no_question"));
            return;
        }
        QuestionEvent event = question.get();
        metrics.questionDetected(event.type().wireName());
        session.emit(new SessionEvent.QuestionDetected(Payloads.QuestionDetected.of(event)));
        startGeneration(session, event);
    }

    private void requestAnswer(LiveSession session, Payloads.RequestAnswer request) {
        if (request.question() == null || request.question().isBlank()) {
            throw new ProtocolException("request_answer requires a non-blank question");
        }
        String question = request.question().strip();
        QuestionType type = request.questionType() == null
                ? QuestionClassifier.classify(question)
                : request.type();
        QuestionEvent event = QuestionEvent.of(question, type, question);
        LOG.info("Answer requested: session={}, questionId={}, preview='{}'",
                session.id(), event.questionId(), LogSanitizer.preview(question, 60));
        session.emit(new SessionEvent.QuestionDetected(Payloads.QuestionDetected.of(event)));
        startGeneration(session, event);
    }

    private void startGeneration(LiveSession session, QuestionEvent event) {
        ContextStore.Baseline baseline = session.context().snapshot();
        long start = System.nanoTime();
        AtomicInteger chunkIndex = new AtomicInteger();
        GenerationHandle handle = generator.generate(event, baseline.payload(), delta ->
                session.emit(new SessionEvent.AnswerChunkStreamed(
                        new Payloads.AnswerChunk(event.questionId(), chunkIndex.getAndIncrement(), delta))));
        session.track(handle);
        LOG.debug("Generation started: session={}, questionId={}, contextVersion={}",
                session.id(), event.questionId(), baseline.version());
        handle.result().whenComplete((record, error) ->
                session.submit(() -> completeGeneration(session, handle, record, error, start)));
    }

    private void completeGeneration(LiveSession session, GenerationHandle handle, AnswerRecord record,
                                    Throwable error, long startNanos) {
        session.untrack(handle);
        if (session.isClosed() || handle.result().isCancelled()) {
            LOG.debug("Dropping generation result: session={}, questionId={}", session.id(), handle.questionId());
            return;
        }
        if (error == null) {
            session.appendAnswer(record);
            metrics.answerDelivered(record.grounding(), record.source().wireName(), System.nanoTime() - startNanos);
            session.emit(new SessionEvent.AnswerReady(Payloads.Answer.of(record)));
            return;
        }

        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof CancellationException) {
            return;
        }
        String reason = cause instanceof GenerationFailureException gfe
                ? gfe.getReason()
                : GenerationFailureException.GENERATION_FAILED;
        boolean timeout = GenerationFailureException.GENERATION_TIMEOUT.equals(reason);
        LOG.warn("Generation failed: session={}, questionId={}, reason={}",
                session.id(), handle.questionId(), reason, cause);
        metrics.generationFailed(reason);
        publisher.publishEvent(new GenerationFailedEvent(session.id(), handle.questionId(), reason, Instant.now()));
        emitError(session,
                timeout ? ErrorCode.GENERATION_TIMEOUT : ErrorCode.GENERATION_FAILED,
                timeout ? "Answer generation timed out" : "Answer generation failed",
                handle.questionId());
    }

    private void clear(LiveSession session) {
        int cancelled = session.cancelGenerations();
        session.transcript().clear();
        session.context().clear();
        session.clearAnswers();
        LOG.info("Session cleared: id={}, cancelledGenerations={}", session.id(), cancelled);
        session.emit(SessionEvent.status(Payloads.Status.CLEARED, null));
    }

    private void updateContext(LiveSession session, ContextPayload payload) {
        ContextStore.Baseline baseline = session.context().replace(payload);
        LOG.info("Context updated: session={}, version={}, stories={}, talkingPoints={}, qaPairs={}, resume={}",
                session.id(), baseline.version(), payload.starStories().size(), payload.talkingPoints().size(),
                payload.qaPairs().size(), !payload.resumeText().isBlank());
        session.emit(SessionEvent.status(Payloads.Status.CONTEXT_ACK, "version=" + baseline.version()));
    }

    private void configure(LiveSession session, Payloads.Config config) {
        String language = config.language() == null || config.language().isBlank()
                ? null
                : config.language().strip().toLowerCase(Locale.ROOT);
        if (!Objects.equals(language, session.language().orElse(null))) {
            RecognitionStream next;
            try {
                next = recognizer.openStream(recognizerProps.sampleRate(), language);
            } catch (RuntimeException e) {
                LOG.warn("Recognizer cannot switch language: session={}, language={}", session.id(), language, e);
                emitError(session, ErrorCode.INTERNAL_ERROR, "Recognition is not available for language " + language, null);
                return;
            }
            RecognitionResult flushed = session.switchRecognition(language, next);
            if (!flushed.isEmpty()) {
                applyRecognition(session, flushed);
            }
            LOG.info("Recognizer language set: session={}, language={}", session.id(), language);
        }
        session.emit(SessionEvent.status(Payloads.Status.CONFIG_ACK, language));
    }

    private void emitError(LiveSession session, ErrorCode code, String message, String questionId) {
        session.emit(SessionEvent.error(code.name(), message, questionId));
    }

    private void send(String sessionId, SessionSink sink, SessionEvent event) {
        if (!sink.isOpen()) {
            LOG.debug("Connection closed; dropping {} event: session={}", event.type().wireName(), sessionId);
            return;
        }
        try {
            sink.send(codec.encode(event.type(), event.payload()));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to send {} event: session={}", event.type().wireName(), sessionId, e);
        }
    }
}
