package com.phillippitts.interviewcopilot.domain;

/**
 * Incremental recognizer output.
 *
 * @param text recognized text (may be empty)
 * @param isFinal true when the recognizer confirmed the segment
 */
public record RecognitionResult(String text, boolean isFinal) {

    public RecognitionResult {
        text = text == null ? "" : text.trim();
    }

    public static RecognitionResult partial(String text) {
        return new RecognitionResult(text, false);
    }

    public static RecognitionResult finalResult(String text) {
        return new RecognitionResult(text, true);
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
