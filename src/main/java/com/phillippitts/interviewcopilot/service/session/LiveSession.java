package com.phillippitts.interviewcopilot.service.session;

import com.phillippitts.interviewcopilot.domain.AnswerRecord;
import com.phillippitts.interviewcopilot.domain.RecognitionResult;
import com.phillippitts.interviewcopilot.service.context.ContextStore;
import com.phillippitts.interviewcopilot.service.events.EventChannel;
import com.phillippitts.interviewcopilot.service.generation.GenerationHandle;
import com.phillippitts.interviewcopilot.service.recognition.RecognitionStream;
import com.phillippitts.interviewcopilot.service.transcript.AudioSequenceMonitor;
import com.phillippitts.interviewcopilot.service.transcript.TranscriptionAccumulator;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One live interview run, tied to a single connection.
 *
 * <p>Owns the session's isolated state: context baseline, running transcript, recognizer stream,
 * audio sequence tracking, and the append-only answer history. All inbound work runs on
 * {@link #submit(Runnable) the ordered queue}; outbound events go through a typed channel with
 * one consumer loop, so delivery order equals emission order.
 *
 * <p>After {@link #close()} queued work is discarded, in-flight generations are cancelled, and
 * no further events are delivered.
 */
public final class LiveSession {

    private final String id;
    private final String userId;
    private final Instant openedAt = Instant.now();

    private final ContextStore context = new ContextStore();
    private final TranscriptionAccumulator transcript = new TranscriptionAccumulator();
    private final AudioSequenceMonitor sequenceMonitor;

    private final Object recognitionLock = new Object();
    // Guarded by recognitionLock; replaced when the session switches language
    private RecognitionStream recognition;

    private final SerialExecutor inbound;
    private final EventChannel<SessionEvent> outbound;

    // Newest first; guarded by itself
    private final Deque<AnswerRecord> answers = new ArrayDeque<>();
    private final Set<GenerationHandle> generations = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile String language;

    LiveSession(String id, String userId, RecognitionStream recognition, Executor sessionExecutor,
                Consumer<SessionEvent> sender) {
        this.id = Objects.requireNonNull(id, "id");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.recognition = Objects.requireNonNull(recognition, "recognition");
        this.sequenceMonitor = new AudioSequenceMonitor(id);
        Map<String, String> logContext = Map.of("sessionId", id, "userId", userId);
        this.inbound = new SerialExecutor("session-in-" + id, sessionExecutor, logContext);
        this.outbound = new EventChannel<>("session-out-" + id, sessionExecutor, logContext, sender);
    }

    public String id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public ContextStore context() {
        return context;
    }

    public TranscriptionAccumulator transcript() {
        return transcript;
    }

    AudioSequenceMonitor sequenceMonitor() {
        return sequenceMonitor;
    }

    public Optional<String> language() {
        return Optional.ofNullable(language);
    }

    /**
     * Swaps the recognizer stream for one opened in another language. The old stream is flushed
     * and closed; a stream offered after close is closed straight away.
     *
     * @return whatever the old stream still held, as a final result
     */
    RecognitionResult switchRecognition(String language, RecognitionStream next) {
        Objects.requireNonNull(next, "next");
        synchronized (recognitionLock) {
            if (closed.get()) {
                next.close();
                return RecognitionResult.finalResult("");
            }
            RecognitionResult flushed = recognition.flush();
            recognition.close();
            recognition = next;
            this.language = language;
            return flushed;
        }
    }

    /** Queues inbound work; dropped once the session is closed. */
    void submit(Runnable task) {
        inbound.execute(task);
    }

    /** Publishes an outbound event; false once the session is closed. */
    boolean emit(SessionEvent event) {
        if (closed.get()) {
            return false;
        }
        return outbound.publish(event);
    }

    Optional<RecognitionResult> recognize(byte[] pcm) {
        synchronized (recognitionLock) {
            return closed.get() ? Optional.empty() : recognition.accept(pcm);
        }
    }

    RecognitionResult flushRecognition() {
        synchronized (recognitionLock) {
            return closed.get() ? RecognitionResult.finalResult("") : recognition.flush();
        }
    }

    void appendAnswer(AnswerRecord record) {
        synchronized (answers) {
            answers.addFirst(record);
        }
    }

    /** Answer history, newest first. */
    public List<AnswerRecord> answers() {
        synchronized (answers) {
            return new ArrayList<>(answers);
        }
    }

    void clearAnswers() {
        synchronized (answers) {
            answers.clear();
        }
    }

    void track(GenerationHandle handle) {
        generations.add(handle);
    }

    void untrack(GenerationHandle handle) {
        generations.remove(handle);
    }

    int inFlightGenerations() {
        return generations.size();
    }

    /** Cancels every in-flight generation. @return number cancelled */
    int cancelGenerations() {
        int cancelled = 0;
        for (GenerationHandle handle : List.copyOf(generations)) {
            if (handle.cancel()) {
                cancelled++;
            }
            generations.remove(handle);
        }
        return cancelled;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes the session: stops both queues, cancels generations, releases the recognizer.
     *
     * @return number of generations cancelled, or -1 if the session was already closed
     */
    int close() {
        if (!closed.compareAndSet(false, true)) {
            return -1;
        }
        inbound.close();
        outbound.close();
        int cancelled = cancelGenerations();
        synchronized (recognitionLock) {
            recognition.close();
        }
        return cancelled;
    }
}
