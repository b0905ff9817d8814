package com.phillippitts.interviewcopilot.service.recognition;

import com.phillippitts.interviewcopilot.domain.RecognitionResult;

import java.util.Optional;

/**
 * Streaming recognition for one session.
 *
 * <p>Not thread-safe: a session feeds its stream only from its ordered queue.
 */
public interface RecognitionStream extends AutoCloseable {

    /**
     * Feeds PCM16LE mono audio. The caller discards the buffer after this returns.
     *
     * @return a partial or final result when the recognizer produced one
     */
    Optional<RecognitionResult> accept(byte[] pcm);

    /**
     * Forces the recognizer to confirm whatever it has buffered (used at a question boundary).
     *
     * @return final result, possibly empty
     */
    RecognitionResult flush();

    /** Releases native resources. Idempotent. */
    @Override
    void close();
}
