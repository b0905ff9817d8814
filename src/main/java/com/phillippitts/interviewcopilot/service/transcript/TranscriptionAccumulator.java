package com.phillippitts.interviewcopilot.service.transcript;

import com.phillippitts.interviewcopilot.domain.RecognitionResult;
import com.phillippitts.interviewcopilot.domain.TranscriptState;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Running transcript of one session between question boundaries.
 *
 * <p>{@code currentSegment} is the latest unconfirmed recognizer output and may be replaced
 * at any time. {@code accumulatedText} grows only by appending confirmed segments and is
 * reset to empty only by {@link #beginBoundary()}, atomically with taking the snapshot.
 *
 * <p><b>Boundary protocol:</b>
 * <pre>
 * beginBoundary()    freeze + reset, later updates are buffered
 * completeBoundary() boundary accepted, buffered updates are applied
 * abortBoundary()    boundary failed, frozen text is restored ahead of the buffer
 * </pre>
 * Either way the transcript ends fully reset or fully intact, never partially cleared.
 *
 * <p><b>Thread Safety:</b> all methods are guarded by a {@link ReentrantLock}.
 *
 * @since 1.0
 */
public final class TranscriptionAccumulator {

    private final Lock lock = new ReentrantLock();

    private String currentSegment = "";
    private final StringBuilder accumulated = new StringBuilder();

    // Non-null while a boundary decision is pending
    private String frozen;
    private final List<RecognitionResult> buffered = new ArrayList<>();

    /**
     * Applies one recognizer result: partial results replace {@code currentSegment};
     * final results are appended to {@code accumulatedText}.
     *
     * @return state after applying the result (unchanged while a boundary is pending)
     */
    public TranscriptState apply(RecognitionResult result) {
        lock.lock();
        try {
            if (frozen != null) {
                buffered.add(result);
                return stateUnlocked();
            }
            applyUnlocked(result);
            return stateUnlocked();
        } finally {
            lock.unlock();
        }
    }

    /** Replaces the unconfirmed segment. */
    public TranscriptState updateSegment(String text) {
        return apply(RecognitionResult.partial(text));
    }

    /** Appends confirmed text and clears the unconfirmed segment. */
    public TranscriptState confirm(String text) {
        return apply(RecognitionResult.finalResult(text));
    }

    public TranscriptState state() {
        lock.lock();
        try {
            return stateUnlocked();
        } finally {
            lock.unlock();
        }
    }

    public boolean isBoundaryPending() {
        lock.lock();
        try {
            return frozen != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Freezes {@code accumulatedText} and resets the transcript in one step.
     *
     * <p>An unconfirmed segment is not part of the snapshot; callers flush the recognizer first.
     *
     * @return frozen snapshot (possibly empty)
     * @throws IllegalStateException if a boundary is already pending
     */
    public String beginBoundary() {
        lock.lock();
        try {
            if (frozen != null) {
                throw new IllegalStateException("A question boundary is already pending");
            }
            frozen = accumulated.toString();
            accumulated.setLength(0);
            currentSegment = "";
            return frozen;
        } finally {
            lock.unlock();
        }
    }

    /** Accepts the pending boundary and applies updates buffered meanwhile. */
    public TranscriptState completeBoundary() {
        lock.lock();
        try {
            requirePending();
            frozen = null;
            replayBufferUnlocked();
            return stateUnlocked();
        } finally {
            lock.unlock();
        }
    }

    /** Restores the frozen snapshot, then applies updates buffered meanwhile. */
    public TranscriptState abortBoundary() {
        lock.lock();
        try {
            requirePending();
            accumulated.setLength(0);
            accumulated.append(frozen);
            frozen = null;
            replayBufferUnlocked();
            return stateUnlocked();
        } finally {
            lock.unlock();
        }
    }

    /** Resets everything, including a pending boundary and its buffer. */
    public void clear() {
        lock.lock();
        try {
            currentSegment = "";
            accumulated.setLength(0);
            frozen = null;
            buffered.clear();
        } finally {
            lock.unlock();
        }
    }

    private void applyUnlocked(RecognitionResult result) {
        if (!result.isFinal()) {
            currentSegment = result.text();
            return;
        }
        if (!result.isEmpty()) {
            if (accumulated.length() > 0) {
                accumulated.append(' ');
            }
            accumulated.append(result.text());
        }
        currentSegment = "";
    }

    private void replayBufferUnlocked() {
        for (RecognitionResult r : buffered) {
            applyUnlocked(r);
        }
        buffered.clear();
    }

    private void requirePending() {
        if (frozen == null) {
            throw new IllegalStateException("No question boundary is pending");
        }
    }

    private TranscriptState stateUnlocked() {
        return new TranscriptState(currentSegment, accumulated.toString());
    }
}
