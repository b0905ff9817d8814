package com.phillippitts.interviewcopilot.util;

/**
 * Shortens interview text (transcripts, questions, answers) before it goes into a log line.
 *
 * <p>Speech is personal data; log statements only ever carry a bounded prefix. Cuts never split a
 * surrogate pair, so the prefix stays valid UTF-16.
 */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /** At most {@code max} code points of {@code s}; "" for null or a non-positive limit. */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        if (s.codePointCount(0, s.length()) <= max) {
            return s;
        }
        return s.substring(0, s.offsetByCodePoints(0, max));
    }

    /** One-line form of {@code s}: whitespace runs collapsed, cut to {@code max} with an ellipsis. */
    public static String preview(String s, int max) {
        if (s == null || s.isBlank()) {
            return "";
        }
        String oneLine = s.strip().replaceAll("\\s+", " ");
        String cut = truncate(oneLine, max);
        return cut.length() == oneLine.length() ? oneLine : cut + ELLIPSIS;
    }
}
