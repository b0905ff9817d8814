package com.phillippitts.interviewcopilot.service.recognition;

/**
 * Speech recognizer boundary. The recognizer itself is an external collaborator; the pipeline
 * only depends on per-session streams of partial and final results.
 */
public interface SpeechRecognizer {

    /**
     * Opens a stream for one session.
     *
     * @param sampleRate sample rate of the audio that will be fed
     * @param language language code from the session's {@code config} message, or null for the
     *        recognizer's default language
     */
    RecognitionStream openStream(int sampleRate, String language);

    /** Short recognizer name for logs and health. */
    String name();

    /** True when the recognizer can open streams (model loaded, native library available). */
    boolean isHealthy();
}
