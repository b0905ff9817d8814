package com.phillippitts.interviewcopilot.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.interviewcopilot.domain.AnswerRecord;
import com.phillippitts.interviewcopilot.domain.QuestionEvent;
import com.phillippitts.interviewcopilot.domain.QuestionType;

import java.util.List;

/**
 * Typed payloads of the envelopes that are not plain domain records.
 *
 * <p>Field names are serialised in snake_case by {@link EnvelopeCodec}.
 */
public final class Payloads {

    private Payloads() {}

    /** {@code request_answer}: regenerate for this question text, bypassing detection. */
    public record RequestAnswer(String question, String questionType) {
        public QuestionType type() {
            return QuestionType.fromWire(questionType);
        }
    }

    /** {@code config}: recognizer language hint. */
    public record Config(String language) {}

    /** {@code transcription}: current segment plus accumulated text. */
    public record Transcription(String text, String accumulatedText,
                                @JsonProperty("is_final") boolean isFinal) {}

    /** {@code question_detected}. */
    public record QuestionDetected(String questionId, String question, String questionType) {
        public static QuestionDetected of(QuestionEvent event) {
            return new QuestionDetected(event.questionId(), event.text(), event.type().wireName());
        }
    }

    /**
     * {@code answer_chunk}: the next fragment of an answer still being generated. Fragments of one
     * question arrive in {@code index} order, starting at 0, and are always followed by the
     * {@code answer} (or {@code error}) for the same question, whose text supersedes them.
     */
    public record AnswerChunk(String questionId, int index, String delta) {}

    /** {@code answer}. {@code createdAt} is epoch millis. */
    public record Answer(String answerId, String questionId, String question, String answer,
                         boolean grounded, String grounding, List<String> storyIds,
                         String source, long createdAt) {
        public static Answer of(AnswerRecord record) {
            return new Answer(record.answerId(), record.questionId(), record.question(),
                    record.answer(), record.grounded(), record.grounding().name(),
                    record.storyIds(), record.source().wireName(), record.createdAt().toEpochMilli());
        }
    }

    /** {@code error}; {@code questionId} is set for generation errors. */
    public record ErrorInfo(String code, String message, String questionId) {}

    /** {@code status}: acknowledgements and processing hints. {@code detail} may be null. */
    public record Status(String state, String detail) {
        public static final String CONNECTED = "connected";
        public static final String DETECTING = "detecting";
        public static final String IDLE = "idle";
        public static final String CONTEXT_ACK = "context_ack";
        public static final String CONFIG_ACK = "config_ack";
        public static final String CLEARED = "cleared";
        public static final String DEGRADED = "degraded";
    }
}
