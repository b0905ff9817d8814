package com.phillippitts.interviewcopilot.service.detection;

import com.phillippitts.interviewcopilot.domain.QuestionType;

import java.util.List;
import java.util.Locale;

/**
 * Keyword classifier for detected questions.
 *
 * <p>Order of checks: situational phrasing ("what would you do") first, since it often also
 * contains technical nouns; then behavioral cues; then technical vocabulary.
 */
public final class QuestionClassifier {

    private static final List<String> SITUATIONAL = List.of(
            "what would you do", "how would you handle", "how would you approach",
            "how would you deal", "imagine", "suppose", "hypothetically", "what if", "if you were");

    private static final List<String> BEHAVIORAL = List.of(
            "tell me about a time", "describe a time", "describe a situation", "give me an example",
            "share an example", "walk me through a time", "have you ever", "a time when", "a time you",
            "conflict", "disagree", "teammate", "challenge", "failure", "mistake", "feedback",
            "proud", "leadership", "difficult", "deadline", "stakeholder");

    private static final List<String> TECHNICAL = List.of(
            "design", "implement", "algorithm", "complexity", "data structure", "database",
            "architecture", "scale", "scalab", "latency", "api", "code", "debug", "system",
            "concurrency", "thread", "cache", "sql", "java", "python", "kubernetes", "microservice",
            "big o", "optimi", "deploy");

    private QuestionClassifier() {}

    public static QuestionType classify(String question) {
        if (question == null || question.isBlank()) {
            return QuestionType.OTHER;
        }
        String text = " " + question.toLowerCase(Locale.ROOT) + " ";
        if (containsAny(text, SITUATIONAL)) {
            return QuestionType.SITUATIONAL;
        }
        if (containsAny(text, BEHAVIORAL)) {
            return QuestionType.BEHAVIORAL;
        }
        if (containsAny(text, TECHNICAL)) {
            return QuestionType.TECHNICAL;
        }
        return QuestionType.OTHER;
    }

    private static boolean containsAny(String text, List<String> cues) {
        for (String cue : cues) {
            if (cue.length() <= 3) {
                // Short cues ("api", "sql") only match whole words
                if (text.matches("(?s).*\\b" + cue + "\\b.*")) {
                    return true;
                }
            } else if (text.contains(cue)) {
                return true;
            }
        }
        return false;
    }
}
