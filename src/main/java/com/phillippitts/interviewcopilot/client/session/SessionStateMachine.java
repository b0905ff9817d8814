package com.phillippitts.interviewcopilot.client.session;

import com.phillippitts.interviewcopilot.client.transport.TransportEvent;
import com.phillippitts.interviewcopilot.protocol.ErrorCode;
import com.phillippitts.interviewcopilot.protocol.Payloads;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Client-side view of a live session.
 *
 * <p>Processing transitions are driven exclusively by {@link TransportEvent}s; audio capture
 * never sets a processing state directly. Answers are kept newest first and survive errors and
 * reconnects. Streamed answer chunks build up {@code partialAnswer} for the pending question until
 * the full answer arrives.
 *
 * <p><b>Thread Safety:</b> all methods are guarded by one lock; {@link #snapshot()} returns an
 * immutable copy.
 */
public final class SessionStateMachine {

    private static final Logger LOG = LogManager.getLogger(SessionStateMachine.class);

    /** Question ids remembered for duplicate suppression; older ids are forgotten first. */
    static final int SEEN_QUESTION_WINDOW = 64;

    /** Last error surfaced to the user. */
    public record SessionError(ErrorCode code, String message, String questionId) { }

    /** Immutable view for rendering. */
    public record Snapshot(ConnectionState connection,
                           ProcessingState processing,
                           String currentText,
                           String accumulatedText,
                           String pendingQuestion,
                           String partialAnswer,
                           List<Payloads.Answer> answers,
                           Optional<SessionError> lastError) { }

    private final Lock lock = new ReentrantLock();
    private final LinkedHashSet<String> seenQuestionIds = new LinkedHashSet<>();
    private final List<Payloads.Answer> answers = new ArrayList<>();
    private final StringBuilder partialAnswer = new StringBuilder();

    private ConnectionState connection = ConnectionState.IDLE;
    private ProcessingState processing = ProcessingState.IDLE;
    private ProcessingState lastStable = ProcessingState.IDLE;
    private String currentText = "";
    private String accumulatedText = "";
    private String pendingQuestion;
    private String pendingQuestionId;
    private SessionError lastError;

    /** Marks the start of the initial connect. */
    public void connecting() {
        lock.lock();
        try {
            connection = ConnectionState.CONNECTING;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies one transport event.
     *
     * @return true if the visible state changed
     */
    public boolean apply(TransportEvent event) {
        Objects.requireNonNull(event, "event");
        lock.lock();
        try {
            ConnectionState beforeConnection = connection;
            ProcessingState beforeProcessing = processing;
            boolean changed = dispatch(event);
            if (beforeConnection != connection || beforeProcessing != processing) {
                LOG.debug("Session state: {}/{} -> {}/{}", beforeConnection, beforeProcessing, connection, processing);
            }
            return changed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a locally detected error (for example a lost microphone) without changing the
     * processing state.
     */
    public void recordError(ErrorCode code, String message) {
        lock.lock();
        try {
            lastError = new SessionError(code, message, null);
        } finally {
            lock.unlock();
        }
    }

    public Snapshot snapshot() {
        lock.lock();
        try {
            return new Snapshot(connection, processing, currentText, accumulatedText, pendingQuestion,
                    partialAnswer.toString(), List.copyOf(answers), Optional.ofNullable(lastError));
        } finally {
            lock.unlock();
        }
    }

    public ConnectionState connection() {
        lock.lock();
        try {
            return connection;
        } finally {
            lock.unlock();
        }
    }

    public ProcessingState processing() {
        lock.lock();
        try {
            return processing;
        } finally {
            lock.unlock();
        }
    }

    private boolean dispatch(TransportEvent event) {
        if (event instanceof TransportEvent.TranscriptionUpdate update) {
            currentText = nullToEmpty(update.text());
            accumulatedText = nullToEmpty(update.accumulatedText());
            enter(ProcessingState.TRANSCRIBING);
            return true;
        }
        if (event instanceof TransportEvent.StatusReceived status) {
            return onStatus(status);
        }
        if (event instanceof TransportEvent.QuestionDetected question) {
            if (!remember(question.questionId())) {
                LOG.debug("Ignoring repeated question {}", question.questionId());
                return false;
            }
            pendingQuestion = question.question();
            pendingQuestionId = question.questionId();
            partialAnswer.setLength(0);
            enter(ProcessingState.GENERATING);
            return true;
        }
        if (event instanceof TransportEvent.AnswerChunkReceived chunk) {
            if (pendingQuestionId == null || !pendingQuestionId.equals(chunk.questionId())) {
                LOG.debug("Ignoring answer chunk {} for question {}", chunk.index(), chunk.questionId());
                return false;
            }
            partialAnswer.append(nullToEmpty(chunk.delta()));
            return true;
        }
        if (event instanceof TransportEvent.AnswerReady ready) {
            answers.add(0, ready.answer());
            currentText = "";
            accumulatedText = "";
            clearPending();
            enter(ProcessingState.IDLE);
            return true;
        }
        if (event instanceof TransportEvent.ErrorReceived error) {
            lastError = new SessionError(error.code(), error.message(), error.questionId());
            if (error.code() == ErrorCode.TRANSPORT_DISCONNECTED) {
                connection = ConnectionState.IDLE;
                enter(ProcessingState.IDLE);
            } else {
                if (processing == ProcessingState.GENERATING) {
                    clearPending();
                }
                processing = lastStable;
            }
            return true;
        }
        if (event instanceof TransportEvent.ConnectionStatusChanged change) {
            return onConnection(change);
        }
        return false;
    }

    private boolean onStatus(TransportEvent.StatusReceived status) {
        String state = status.state();
        if (Payloads.Status.DETECTING.equals(state)) {
            enter(ProcessingState.DETECTING);
            return true;
        }
        if (Payloads.Status.IDLE.equals(state)) {
            enter(ProcessingState.IDLE);
            return true;
        }
        if (Payloads.Status.CLEARED.equals(state)) {
            answers.clear();
            seenQuestionIds.clear();
            currentText = "";
            accumulatedText = "";
            clearPending();
            enter(ProcessingState.IDLE);
            return true;
        }
        // Acknowledgements and degraded notices carry no transition
        return false;
    }

    private boolean onConnection(TransportEvent.ConnectionStatusChanged change) {
        switch (change.status()) {
            case CONNECTED:
            case RECONNECTED:
                connection = ConnectionState.STREAMING;
                return true;
            case RECONNECTING:
                // The server drops the transcript and any in-flight answer with the old socket
                connection = ConnectionState.CONNECTING;
                currentText = "";
                accumulatedText = "";
                clearPending();
                enter(ProcessingState.IDLE);
                return true;
            case DISCONNECTED:
                connection = ConnectionState.IDLE;
                enter(ProcessingState.IDLE);
                return true;
            default:
                return false;
        }
    }

    private boolean remember(String questionId) {
        if (!seenQuestionIds.add(questionId)) {
            return false;
        }
        if (seenQuestionIds.size() > SEEN_QUESTION_WINDOW) {
            seenQuestionIds.remove(seenQuestionIds.iterator().next());
        }
        return true;
    }

    private void clearPending() {
        pendingQuestion = null;
        pendingQuestionId = null;
        partialAnswer.setLength(0);
    }

    private void enter(ProcessingState next) {
        processing = next;
        if (next.isStable()) {
            lastStable = next;
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
