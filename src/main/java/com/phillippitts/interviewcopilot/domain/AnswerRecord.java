package com.phillippitts.interviewcopilot.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable suggested answer. Records are appended to a session's history and never edited.
 */
public record AnswerRecord(
        String answerId,
        String questionId,
        String question,
        String answer,
        Instant createdAt,
        Grounding grounding,
        List<String> storyIds,
        AnswerSource source
) {
    public AnswerRecord {
        Objects.requireNonNull(answerId, "answerId");
        Objects.requireNonNull(question, "question");
        Objects.requireNonNull(answer, "answer");
        createdAt = createdAt == null ? Instant.now() : createdAt;
        grounding = grounding == null ? Grounding.NONE : grounding;
        storyIds = storyIds == null ? List.of() : List.copyOf(storyIds);
        source = source == null ? AnswerSource.GENERATED : source;
    }

    public static AnswerRecord generated(String questionId, String question, String answer,
                                         Grounding grounding, List<String> storyIds) {
        return new AnswerRecord(UUID.randomUUID().toString(), questionId, question, answer,
                Instant.now(), grounding, storyIds, AnswerSource.GENERATED);
    }

    public static AnswerRecord uploaded(String questionId, String question, String answer) {
        return new AnswerRecord(UUID.randomUUID().toString(), questionId, question, answer,
                Instant.now(), Grounding.PROFILE, List.of(), AnswerSource.UPLOADED);
    }

    /** False only for the generic fallback built without any stored context. */
    public boolean grounded() {
        return grounding != Grounding.NONE;
    }
}
