package com.phillippitts.interviewcopilot.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A complete interviewer question detected at a boundary.
 *
 * <p>Triggers exactly one answer generation unless explicitly replayed through
 * {@code request_answer}.
 *
 * @param questionId unique id; clients use it to ignore duplicate deliveries
 * @param text question text
 * @param type classification
 * @param transcriptSnapshot frozen transcript the question was derived from
 * @param detectedAt detection time
 */
public record QuestionEvent(
        String questionId,
        String text,
        QuestionType type,
        String transcriptSnapshot,
        Instant detectedAt
) {
    public QuestionEvent {
        Objects.requireNonNull(questionId, "questionId");
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("question text must not be blank");
        }
        type = type == null ? QuestionType.OTHER : type;
        transcriptSnapshot = transcriptSnapshot == null ? "" : transcriptSnapshot;
        detectedAt = detectedAt == null ? Instant.now() : detectedAt;
    }

    public static QuestionEvent of(String text, QuestionType type, String snapshot) {
        return new QuestionEvent(UUID.randomUUID().toString(), text, type, snapshot, Instant.now());
    }
}
