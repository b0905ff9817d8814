package com.phillippitts.interviewcopilot.service.session;

import com.phillippitts.interviewcopilot.protocol.MessageType;
import com.phillippitts.interviewcopilot.protocol.Payloads;

/**
 * Server-to-client events of one live session.
 *
 * <p>Every event maps to exactly one outbound envelope, so the session's single consumer loop
 * encodes and sends them without dispatching on the concrete kind.
 */
public sealed interface SessionEvent {

    MessageType type();

    Object payload();

    record TranscriptionUpdated(Payloads.Transcription payload) implements SessionEvent {
        @Override
        public MessageType type() {
            return MessageType.TRANSCRIPTION;
        }
    }

    record QuestionDetected(Payloads.QuestionDetected payload) implements SessionEvent {
        @Override
        public MessageType type() {
            return MessageType.QUESTION_DETECTED;
        }
    }

    record AnswerChunkStreamed(Payloads.AnswerChunk payload) implements SessionEvent {
        @Override
        public MessageType type() {
            return MessageType.ANSWER_CHUNK;
        }
    }

    record AnswerReady(Payloads.Answer payload) implements SessionEvent {
        @Override
        public MessageType type() {
            return MessageType.ANSWER;
        }
    }

    record ErrorRaised(Payloads.ErrorInfo payload) implements SessionEvent {
        @Override
        public MessageType type() {
            return MessageType.ERROR;
        }
    }

    record StatusChanged(Payloads.Status payload) implements SessionEvent {
        @Override
        public MessageType type() {
            return MessageType.STATUS;
        }
    }

    static SessionEvent status(String state, String detail) {
        return new StatusChanged(new Payloads.Status(state, detail));
    }

    static SessionEvent error(String code, String message, String questionId) {
        return new ErrorRaised(new Payloads.ErrorInfo(code, message, questionId));
    }
}
